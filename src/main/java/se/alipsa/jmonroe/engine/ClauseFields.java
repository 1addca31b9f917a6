package se.alipsa.jmonroe.engine;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.MultiPartName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jmonroe.schema.TableSchema;

/** Finds the field a filter clause constrains, for pushing the clause down to matching tables. */
public final class ClauseFields {

  private static final Logger log = LoggerFactory.getLogger(ClauseFields.class);

  /** The time column, present in every measurement. */
  public static final String TIME = "time";

  private ClauseFields() {
  }

  /**
   * The leading field of a clause: the first column the parsed condition references. Clauses the
   * SQL parser rejects (for instance InfluxQL regex matches such as {@code Operator =~ /Telia/})
   * fall back to the leading identifier of the text.
   *
   * @param clause
   *          the filter clause
   * @return the unquoted field name, or an empty string when none is found
   */
  public static String leadingField(String clause) {
    if (clause == null || clause.isBlank()) {
      return "";
    }
    try {
      Expression condition = CCJSqlParserUtil.parseCondExpression(clause);
      String first = firstColumn(condition);
      if (first != null) {
        return MultiPartName.unquote(first);
      }
    } catch (JSQLParserException | RuntimeException e) {
      if (log.isDebugEnabled()) {
        log.debug("Clause '{}' is not SQL, using its leading identifier: {}", clause, e.getMessage());
      }
    }
    return leadingIdentifier(clause);
  }

  /**
   * Check whether a clause can be pushed down to a table.
   *
   * @param clause
   *          the filter clause
   * @param table
   *          the target table
   * @return {@code true} when the leading field is {@code time} or a column of the table
   */
  public static boolean appliesTo(String clause, TableSchema table) {
    String field = leadingField(clause);
    if (field.isEmpty()) {
      return false;
    }
    return TIME.equalsIgnoreCase(field) || table.hasColumn(field);
  }

  private static String firstColumn(Expression condition) {
    String[] first = new String[1];
    ExpressionVisitorAdapter<Void> walker = new ExpressionVisitorAdapter<Void>() {
      @Override
      public <S> Void visit(Column column, S context) {
        if (first[0] == null) {
          first[0] = column.getColumnName();
        }
        return null;
      }
    };
    condition.accept(walker);
    return first[0];
  }

  static String leadingIdentifier(String clause) {
    int i = 0;
    int length = clause.length();
    while (i < length) {
      char c = clause.charAt(i);
      if (Character.isWhitespace(c) || c == '(' || c == '"' || c == '`' || c == '[') {
        i++;
      } else {
        break;
      }
    }
    int start = i;
    while (i < length) {
      char c = clause.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
        i++;
      } else {
        break;
      }
    }
    String identifier = clause.substring(start, i);
    int dot = identifier.lastIndexOf('.');
    return dot >= 0 ? identifier.substring(dot + 1) : identifier;
  }
}
