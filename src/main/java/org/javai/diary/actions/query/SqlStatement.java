package org.javai.diary.actions.query;

import java.util.Objects;
import net.sf.jsqlparser.statement.select.Select;

/**
 * A SQL string that passed {@link SqlGuard}: a single SELECT statement.
 *
 * @param sql the accepted SQL text, without a trailing semicolon
 * @param select the parsed statement
 */
public record SqlStatement(String sql, Select select) {

	public SqlStatement {
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(select, "select must not be null");
	}

	@Override
	public String toString() {
		return sql;
	}
}
