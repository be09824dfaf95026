package org.javai.diary.actions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.javai.diary.actions.AssistantConfig.ResolverPolicy;
import org.javai.diary.actions.resolve.RankedEntityResolver;
import org.javai.diary.actions.resolve.RecencyEntityResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AssistantConfigTest {

	private static InputStream yaml(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("defaults match the bundled configuration")
	void defaults() {
		AssistantConfig defaults = AssistantConfig.defaults();

		assertThat(defaults.catalogWindow()).isEqualTo(500);
		assertThat(defaults.resolver()).isEqualTo(ResolverPolicy.RANKED);
		assertThat(defaults.revalidateOnEdit()).isTrue();
		assertThat(defaults.maxResultRows()).isEqualTo(1000);
		assertThat(AssistantConfig.load()).isEqualTo(defaults);
	}

	@Test
	@DisplayName("missing keys keep their defaults")
	void partialYaml() {
		AssistantConfig config = AssistantConfig.fromYaml(yaml("""
				resolver: recency
				revalidate-on-edit: false
				"""));

		assertThat(config.resolver()).isEqualTo(ResolverPolicy.RECENCY);
		assertThat(config.resolver().create()).isInstanceOf(RecencyEntityResolver.class);
		assertThat(config.revalidateOnEdit()).isFalse();
		assertThat(config.catalogWindow()).isEqualTo(500);
		assertThat(config.maxResultRows()).isEqualTo(1000);
	}

	@Test
	@DisplayName("numeric values may be quoted")
	void quotedNumbers() {
		AssistantConfig config = AssistantConfig.fromYaml(yaml("catalog-window: '120'\nmax-result-rows: 50\n"));

		assertThat(config.catalogWindow()).isEqualTo(120);
		assertThat(config.maxResultRows()).isEqualTo(50);
		assertThat(config.resolver().create()).isInstanceOf(RankedEntityResolver.class);
	}

	@Test
	@DisplayName("an empty document yields the defaults")
	void emptyYaml() {
		assertThat(AssistantConfig.fromYaml(yaml(""))).isEqualTo(AssistantConfig.defaults());
	}

	@Test
	@DisplayName("invalid values are rejected")
	void invalidValues() {
		String[] documents = {
				"resolver: fuzzy",
				"catalog-window: lots",
				"catalog-window: 0",
				"max-result-rows: -5",
				"resolver: [ranked"
		};
		for (String document : documents) {
			assertThatThrownBy(() -> AssistantConfig.fromYaml(yaml(document)))
					.as(document)
					.isInstanceOf(AssistantConfigException.class);
		}
	}
}
