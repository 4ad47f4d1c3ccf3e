package com.shardsql.generator;

import com.shardsql.exception.UnsupportedExpressionException;
import com.shardsql.expression.AggregateFunction;
import com.shardsql.expression.Alias;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.BinaryExpression;
import com.shardsql.expression.CastExpression;
import com.shardsql.expression.Expression;
import com.shardsql.expression.ExpressionVisitor;
import com.shardsql.expression.FunctionCall;
import com.shardsql.expression.InExpression;
import com.shardsql.expression.Literal;
import com.shardsql.expression.OpaqueExpression;
import com.shardsql.expression.SortOrder;
import com.shardsql.expression.UnaryExpression;
import com.shardsql.functions.FunctionRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.shardsql.generator.SQLQuoting.quoteIdentifier;

/**
 * Accumulates one SQL fragment (a SELECT list, a WHERE clause, ...) against a
 * fixed set of columns in scope.
 *
 * <p>Column references are resolved by {@link com.shardsql.expression.ExprId}
 * against the scope and render as {@code `alias`.`field`}, using the field name
 * the producing subquery gave the column. Anything that cannot be rendered
 * exactly throws {@link UnsupportedExpressionException}:
 * <ul>
 *   <li>a reference to a column no child in scope produces</li>
 *   <li>a reference that two different children in scope produce</li>
 *   <li>an opaque expression, a nested alias, an unmapped function or cast</li>
 *   <li>an aggregate function outside an aggregate SELECT list</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   String where = SQLBuilder.withFields(child.qualifiedOutput())
 *       .raw(" WHERE ")
 *       .addExpression(condition)
 *       .sql();
 * </pre>
 *
 * <p>A builder is single-use and not thread-safe.
 */
public final class SQLBuilder {

    private final List<QualifiedAttribute> fields;
    private final StringBuilder sql = new StringBuilder();
    private final Renderer renderer = new Renderer();
    private boolean aggregatesAllowed;

    private SQLBuilder(List<QualifiedAttribute> fields) {
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "fields must not be null"));
    }

    /**
     * Creates a builder whose expressions may reference the given columns.
     *
     * @param fields the columns in scope
     * @return a new builder
     */
    public static SQLBuilder withFields(List<QualifiedAttribute> fields) {
        return new SQLBuilder(fields);
    }

    /**
     * Permits aggregate functions in the expressions added to this builder.
     *
     * @return this builder
     */
    public SQLBuilder allowingAggregates() {
        this.aggregatesAllowed = true;
        return this;
    }

    /**
     * Appends raw SQL text.
     *
     * @param text the text
     * @return this builder
     */
    public SQLBuilder raw(String text) {
        sql.append(text);
        return this;
    }

    /**
     * Appends one rendered expression. A top-level {@link Alias} renders as
     * {@code expr AS `name`}.
     *
     * @param expression the expression
     * @return this builder
     * @throws UnsupportedExpressionException if the expression cannot be rendered
     */
    public SQLBuilder addExpression(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression instanceof Alias) {
            Alias alias = (Alias) expression;
            sql.append(alias.child().accept(renderer))
               .append(" AS ")
               .append(quoteIdentifier(alias.name()));
        } else {
            sql.append(expression.accept(renderer));
        }
        return this;
    }

    /**
     * Appends expressions joined by a separator. Appends nothing for an empty list.
     *
     * @param expressions the expressions
     * @param separator the separator, for example {@code ", "}
     * @return this builder
     * @throws UnsupportedExpressionException if an expression cannot be rendered
     */
    public SQLBuilder addExpressions(List<? extends Expression> expressions, String separator) {
        boolean first = true;
        for (Expression expression : expressions) {
            if (!first) {
                sql.append(separator);
            }
            addExpression(expression);
            first = false;
        }
        return this;
    }

    /**
     * Appends expressions joined by a separator, or reports that there was
     * nothing to append.
     *
     * <p>Used where the surrounding text must disappear along with an empty list,
     * such as {@code " GROUP BY "} with no grouping expressions.
     *
     * @param expressions the expressions
     * @param separator the separator
     * @return this builder, or empty if the list is empty
     * @throws UnsupportedExpressionException if an expression cannot be rendered
     */
    public Optional<SQLBuilder> maybeAddExpressions(List<? extends Expression> expressions, String separator) {
        if (expressions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(addExpressions(expressions, separator));
    }

    /**
     * Returns the SQL accumulated so far.
     *
     * @return the SQL text
     */
    public String sql() {
        return sql.toString();
    }

    @Override
    public String toString() {
        return sql();
    }

    private QualifiedAttribute resolve(AttributeReference reference) {
        QualifiedAttribute match = null;
        for (QualifiedAttribute field : fields) {
            if (!field.attribute().exprId().equals(reference.exprId())) {
                continue;
            }
            if (match == null) {
                match = field;
            } else if (!match.qualifier().equals(field.qualifier())) {
                throw new UnsupportedExpressionException(
                    "Column is produced by both " + match.qualifier() + " and " + field.qualifier(), reference);
            }
        }
        if (match == null) {
            throw new UnsupportedExpressionException("Column is not in scope", reference);
        }
        return match;
    }

    /**
     * Renders one expression subtree. Every kind is handled here, so this is the
     * only place an expression can turn out to be unsupported.
     */
    private final class Renderer implements ExpressionVisitor<String> {

        @Override
        public String visitAttributeReference(AttributeReference attribute) {
            return resolve(attribute).toSQL();
        }

        @Override
        public String visitAlias(Alias alias) {
            // SQL has no nested aliases: x AS y AS z is invalid
            throw new UnsupportedExpressionException("Alias is only valid at the top of a SELECT list", alias);
        }

        @Override
        public String visitLiteral(Literal literal) {
            return SQLQuoting.formatLiteral(literal);
        }

        @Override
        public String visitBinary(BinaryExpression binary) {
            return String.format("(%s %s %s)",
                binary.left().accept(this), binary.operator().symbol(), binary.right().accept(this));
        }

        @Override
        public String visitUnary(UnaryExpression unary) {
            String operand = unary.operand().accept(this);
            if (unary.operator().isPrefix()) {
                // The space keeps "- -1" from reading as a comment marker
                return String.format("(%s %s)", unary.operator().symbol(), operand);
            }
            return String.format("(%s %s)", operand, unary.operator().symbol());
        }

        @Override
        public String visitIn(InExpression in) {
            if (in.list().isEmpty()) {
                throw new UnsupportedExpressionException("IN with an empty value list", in);
            }
            List<String> values = new ArrayList<>(in.list().size());
            for (Expression value : in.list()) {
                values.add(value.accept(this));
            }
            return String.format("(%s %sIN (%s))",
                in.value().accept(this), in.isNegated() ? "NOT " : "", String.join(", ", values));
        }

        @Override
        public String visitCast(CastExpression cast) {
            String target = TypeMapper.toCastType(cast.targetType())
                .orElseThrow(() -> new UnsupportedExpressionException("No remote cast to " + cast.targetType(), cast));
            return String.format("CAST(%s AS %s)", cast.child().accept(this), target);
        }

        @Override
        public String visitFunctionCall(FunctionCall function) {
            String[] args = new String[function.arguments().size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = function.arguments().get(i).accept(this);
            }
            return FunctionRegistry.translate(function.functionName(), args)
                .orElseThrow(() -> new UnsupportedExpressionException("Function has no remote equivalent", function));
        }

        @Override
        public String visitAggregateFunction(AggregateFunction aggregate) {
            if (!aggregatesAllowed) {
                throw new UnsupportedExpressionException("Aggregate function outside of an aggregation", aggregate);
            }
            if (aggregate.isRowCount()) {
                return "COUNT(*)";
            }
            Expression argument = aggregate.argument()
                .orElseThrow(() -> new UnsupportedExpressionException("Aggregate without argument", aggregate));
            // Nested aggregates are rejected by the remote engine as well
            boolean outer = aggregatesAllowed;
            aggregatesAllowed = false;
            try {
                return String.format("%s(%s%s)", aggregate.kind().name(),
                    aggregate.isDistinct() ? "DISTINCT " : "", argument.accept(this));
            } finally {
                aggregatesAllowed = outer;
            }
        }

        @Override
        public String visitSortOrder(SortOrder sortOrder) {
            String key = sortOrder.child().accept(this);
            String direction = sortOrder.direction() == SortOrder.Direction.ASCENDING ? "ASC" : "DESC";
            if (sortOrder.hasDefaultNullOrdering()) {
                return key + " " + direction;
            }
            // The remote engine has no NULLS FIRST/LAST; a leading IS NULL key moves the nulls
            return String.format("(%s IS NULL) %s, %s %s", key, direction, key, direction);
        }

        @Override
        public String visitOpaque(OpaqueExpression opaque) {
            throw new UnsupportedExpressionException("Expression has no SQL rendering", opaque);
        }
    }
}
