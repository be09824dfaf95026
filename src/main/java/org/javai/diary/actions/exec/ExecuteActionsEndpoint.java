package org.javai.diary.actions.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.diary.actions.api.ActionKind;
import org.javai.diary.actions.api.ActionPayload;
import org.javai.diary.actions.api.CatalogAction;
import org.javai.diary.actions.api.Workspace;
import org.javai.diary.actions.generate.RawAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server-side entry point that executes a batch of approved actions sent as JSON.
 *
 * <pre>
 * POST { "actions": [ { "type": "update", "id": "media-7", "data": { "status": "Finished" } } ] }
 *
 * 200  { "success": true, "results": [ ... ], "summary": { "total": 1, "succeeded": 1, "failed": 0 } }
 * 400  { "success": false, "error": "Missing or invalid actions field" }
 * 400  { "success": false, "error": "No actions provided" }
 * 500  { "success": false, "error": "..." }
 * </pre>
 *
 * <p>An optional {@code "workspace"} field selects the catalog ({@code media} by default). Items whose
 * type is not a known action kind fail individually with {@code "Unknown action type: X"}.</p>
 */
public class ExecuteActionsEndpoint {

	private static final Logger logger = LoggerFactory.getLogger(ExecuteActionsEndpoint.class);

	static final String INVALID_ACTIONS = "Missing or invalid actions field";
	static final String NO_ACTIONS = "No actions provided";

	private final BatchExecutor executor;
	private final ObjectMapper mapper;

	public ExecuteActionsEndpoint(BatchExecutor executor) {
		this(executor, new ObjectMapper());
	}

	public ExecuteActionsEndpoint(BatchExecutor executor, ObjectMapper mapper) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * Handle a raw JSON request body.
	 */
	public EndpointResponse handle(String requestBody) {
		try {
			ExecuteActionsRequest request;
			try {
				request = parse(requestBody);
			}
			catch (BadRequest ex) {
				return respond(EndpointResponse.BAD_REQUEST, ExecuteActionsResponse.error(ex.getMessage()));
			}
			if (request.actions().isEmpty()) {
				return respond(EndpointResponse.BAD_REQUEST, ExecuteActionsResponse.error(NO_ACTIONS));
			}
			return respond(EndpointResponse.OK, handle(request));
		}
		catch (RuntimeException ex) {
			logger.error("Execute actions error", ex);
			String message = ex.getMessage() != null ? ex.getMessage() : "Unknown error occurred";
			return respond(EndpointResponse.SERVER_ERROR, ExecuteActionsResponse.error(message));
		}
	}

	/**
	 * Execute an already parsed request. Known actions run as one batch, in order; unknown ones are
	 * reported as failures in their original position.
	 */
	public ExecuteActionsResponse handle(ExecuteActionsRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		List<RawAction> submitted = request.actions();

		List<CatalogAction> runnable = new ArrayList<>();
		List<Integer> runnableIndices = new ArrayList<>();
		ExecuteActionsResponse.Result[] results = new ExecuteActionsResponse.Result[submitted.size()];
		for (int i = 0; i < submitted.size(); i++) {
			RawAction raw = submitted.get(i);
			try {
				ActionKind kind = ActionKind.fromWireValue(raw.type());
				runnable.add(new CatalogAction(kind, raw.id(), ActionPayload.of(raw.data())));
				runnableIndices.add(i);
			}
			catch (IllegalArgumentException ex) {
				results[i] = ExecuteActionsResponse.Result.failed(raw, "Unknown action type: " + raw.type());
			}
		}

		BatchReport report = executor.execute(request.workspace(), runnable);
		for (int j = 0; j < runnableIndices.size(); j++) {
			int index = runnableIndices.get(j);
			results[index] = ExecuteActionsResponse.Result.of(submitted.get(index), report.results().get(j));
		}
		return ExecuteActionsResponse.completed(List.of(results));
	}

	private ExecuteActionsRequest parse(String requestBody) {
		JsonNode root;
		try {
			root = requestBody != null ? mapper.readTree(requestBody) : null;
		}
		catch (JsonProcessingException ex) {
			throw new BadRequest(INVALID_ACTIONS);
		}
		if (root == null || !root.isObject() || !root.path("actions").isArray()) {
			throw new BadRequest(INVALID_ACTIONS);
		}

		Workspace workspace = Workspace.MEDIA;
		JsonNode workspaceNode = root.path("workspace");
		if (workspaceNode.isTextual()) {
			try {
				workspace = Workspace.fromWireValue(workspaceNode.asText());
			}
			catch (IllegalArgumentException ex) {
				throw new BadRequest(ex.getMessage());
			}
		}

		List<RawAction> actions = new ArrayList<>();
		for (JsonNode item : root.get("actions")) {
			if (!item.isObject()) {
				throw new BadRequest(INVALID_ACTIONS);
			}
			try {
				actions.add(mapper.treeToValue(item, RawAction.class));
			}
			catch (JsonProcessingException ex) {
				throw new BadRequest(INVALID_ACTIONS);
			}
		}
		return new ExecuteActionsRequest(workspace, actions);
	}

	private EndpointResponse respond(int status, ExecuteActionsResponse response) {
		try {
			return new EndpointResponse(status, mapper.writeValueAsString(response));
		}
		catch (JsonProcessingException ex) {
			throw new IllegalStateException("Failed to serialize response", ex);
		}
	}

	/**
	 * Request body problems that map to a 400 response.
	 */
	private static final class BadRequest extends RuntimeException {
		BadRequest(String message) {
			super(message);
		}
	}
}
