package org.javai.diary.actions.intent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IntentClassifier")
class IntentClassifierTest {

	private final IntentClassifier classifier = new IntentClassifier();

	@Test
	@DisplayName("action verbs route to action mode")
	void actionVerbs() {
		assertThat(classifier.classify("Add Dune Part 3, The Batman 2 to planned")).isEqualTo(Intent.ACTION);
		assertThat(classifier.classify("Mark Inception as finished with 9/10")).isEqualTo(Intent.ACTION);
		assertThat(classifier.classify("Delete The Room from my list")).isEqualTo(Intent.ACTION);
		assertThat(classifier.classify("please SET my rating for Dune to 8")).isEqualTo(Intent.ACTION);
	}

	@Test
	@DisplayName("inflected verbs count")
	void inflections() {
		assertThat(classifier.classify("I finished it, updating the status")).isEqualTo(Intent.ACTION);
		assertThat(classifier.classify("removed from watchlist: Alien")).isEqualTo(Intent.ACTION);
		assertThat(classifier.classify("changed my mind about Tenet")).isEqualTo(Intent.ACTION);
	}

	@Test
	@DisplayName("plain questions route to query mode")
	void questions() {
		assertThat(classifier.classify("How many movies did I watch in 2023?")).isEqualTo(Intent.QUERY);
		assertThat(classifier.classify("average rating by genre")).isEqualTo(Intent.QUERY);
	}

	@Test
	@DisplayName("keywords must be whole words")
	void wholeWordsOnly() {
		assertThat(classifier.classify("show my address book and settings")).isEqualTo(Intent.QUERY);
		assertThat(classifier.classify("what was newest?")).isEqualTo(Intent.QUERY);
	}

	@Test
	@DisplayName("questions that mention a verb still go to action mode")
	void recallOverPrecision() {
		assertThat(classifier.classify("what did I add last week?")).isEqualTo(Intent.ACTION);
	}

	@Test
	@DisplayName("blank input is a query")
	void blank() {
		assertThat(classifier.classify(null)).isEqualTo(Intent.QUERY);
		assertThat(classifier.classify("   ")).isEqualTo(Intent.QUERY);
	}
}
