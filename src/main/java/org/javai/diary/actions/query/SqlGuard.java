package org.javai.diary.actions.query;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Read-only allow-list for generated SQL.
 *
 * <p>A statement is accepted only when all of the following hold:</p>
 * <ul>
 *   <li>it starts with {@code SELECT} (case-insensitive, leading whitespace allowed)</li>
 *   <li>none of {@code INSERT UPDATE DELETE DROP ALTER CREATE TRUNCATE GRANT REVOKE} appears as a whole word</li>
 *   <li>it is a single statement that parses as a SELECT</li>
 * </ul>
 *
 * <p>The keyword check is lexical, so a string literal containing a forbidden word is also rejected.
 * A trailing semicolon is tolerated.</p>
 */
public class SqlGuard {

	private static final Pattern STARTS_WITH_SELECT = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern FORBIDDEN = Pattern.compile(
			"\\b(INSERT|UPDATE|DELETE|DROP|ALTER|CREATE|TRUNCATE|GRANT|REVOKE)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[\\s;]+$");

	/**
	 * @param sql generated SQL
	 * @return the accepted statement
	 * @throws QueryValidationException if the SQL is not an allowed read-only query
	 */
	public SqlStatement check(String sql) {
		if (sql == null || sql.isBlank()) {
			throw new QueryValidationException("SQL string cannot be null or blank");
		}
		String cleaned = TRAILING_SEMICOLONS.matcher(sql.trim()).replaceAll("");

		if (!STARTS_WITH_SELECT.matcher(cleaned).find()) {
			throw new QueryValidationException("Only SELECT queries are allowed");
		}
		Matcher forbidden = FORBIDDEN.matcher(cleaned);
		if (forbidden.find()) {
			throw new QueryValidationException("Query contains forbidden keyword: " + forbidden.group(1).toUpperCase(Locale.ROOT));
		}
		Statements statements;
		try {
			statements = CCJSqlParserUtil.parseStatements(cleaned);
		}
		catch (JSQLParserException e) {
			throw new QueryValidationException("Invalid SQL syntax: " + e.getMessage(), e);
		}
		if (statements.size() != 1) {
			throw new QueryValidationException("Only a single statement is allowed");
		}
		Statement stmt = statements.get(0);
		if (!(stmt instanceof Select select)) {
			throw new QueryValidationException(
					"Only SELECT statements are allowed, got: " + stmt.getClass().getSimpleName());
		}
		return new SqlStatement(cleaned, select);
	}

	/**
	 * Boolean form of {@link #check(String)}.
	 */
	public boolean isAllowed(String sql) {
		try {
			check(sql);
			return true;
		}
		catch (QueryValidationException e) {
			return false;
		}
	}
}
