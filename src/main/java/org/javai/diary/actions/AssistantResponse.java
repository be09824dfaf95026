package org.javai.diary.actions;

import java.util.Objects;
import org.javai.diary.actions.confirm.ConfirmationSession;
import org.javai.diary.actions.query.QueryResult;

/**
 * What the assistant returns for one request.
 */
public sealed interface AssistantResponse
		permits AssistantResponse.Answer, AssistantResponse.Proposal, AssistantResponse.Failure {

	/**
	 * Query mode: rows and a rendering.
	 */
	record Answer(QueryResult result) implements AssistantResponse {
		public Answer {
			Objects.requireNonNull(result, "result must not be null");
		}
	}

	/**
	 * Action mode: a validated batch awaiting the user's confirmation.
	 */
	record Proposal(ConfirmationSession session) implements AssistantResponse {
		public Proposal {
			Objects.requireNonNull(session, "session must not be null");
		}
	}

	/**
	 * Nothing could be produced; {@code message} is suitable for the user.
	 */
	record Failure(String message) implements AssistantResponse {
		public Failure {
			message = message != null ? message : "Request failed";
		}
	}
}
