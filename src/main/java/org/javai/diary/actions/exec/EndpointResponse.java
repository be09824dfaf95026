package org.javai.diary.actions.exec;

/**
 * HTTP-style response produced by {@link ExecuteActionsEndpoint}: a status code and a JSON body.
 */
public record EndpointResponse(int status, String body) {

	public static final int OK = 200;
	public static final int BAD_REQUEST = 400;
	public static final int SERVER_ERROR = 500;

	public boolean isOk() {
		return status == OK;
	}
}
