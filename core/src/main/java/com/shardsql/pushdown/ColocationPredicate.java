package com.shardsql.pushdown;

import com.shardsql.catalog.DistributionDescriptor;
import com.shardsql.catalog.DistributionDescriptor.KeyColumn;
import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.BinaryExpression;
import com.shardsql.expression.ExprId;
import com.shardsql.expression.Expression;
import com.shardsql.pushdown.query.AbstractQuery;
import com.shardsql.pushdown.query.BaseQuery;
import com.shardsql.pushdown.query.ShardKey;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether two subqueries can be joined on the remote engine without
 * moving data between nodes.
 *
 * <p>Every base table beneath either side must live on the same cluster, and
 * every pairing of a left table with a right table must satisfy one of:
 * <ul>
 *   <li>either table is a reference table, replicated to every node</li>
 *   <li>both are sharded in the same database with the same partition count and
 *       shard keys of equal arity and pairwise equal types</li>
 * </ul>
 * When both sides read sharded tables, the join must also match rows on the
 * shard key: each side has to carry a shard key up to its output, and the
 * condition has to equate left key column {@code i} with right key column
 * {@code i} for every {@code i}, as plain equalities joined by AND. A sharded
 * table with an empty shard key is spread at random and never pairs with
 * another sharded table.
 */
public final class ColocationPredicate {

    private static final Logger logger = LoggerFactory.getLogger(ColocationPredicate.class);

    private ColocationPredicate() {}

    /**
     * Tests whether a join between two subqueries may be pushed down.
     *
     * @param left the left side
     * @param right the right side
     * @param condition the join condition, resolved against both sides' output
     * @return true if matching rows of the two sides are on the same node
     */
    public static boolean sharesCluster(AbstractQuery left, AbstractQuery right, Optional<Expression> condition) {
        List<BaseQuery> leftBases = left.baseQueries();
        List<BaseQuery> rightBases = right.baseQueries();
        if (leftBases.isEmpty() || rightBases.isEmpty()) {
            return false;
        }

        String clusterId = leftBases.get(0).distribution().clusterId();
        if (!allOnCluster(leftBases, clusterId) || !allOnCluster(rightBases, clusterId)) {
            logger.debug("Join sides span more than one cluster");
            return false;
        }

        for (BaseQuery l : leftBases) {
            for (BaseQuery r : rightBases) {
                if (!compatible(l, r)) {
                    logger.debug("Tables {} and {} are not co-located", l.table(), r.table());
                    return false;
                }
            }
        }

        if (anySharded(leftBases) && anySharded(rightBases)
                && !joinsOnShardKey(left.shardKeys(), right.shardKeys(), condition)) {
            logger.debug("Join condition {} does not match rows on the shard key", condition.orElse(null));
            return false;
        }
        return true;
    }

    private static boolean allOnCluster(List<BaseQuery> bases, String clusterId) {
        for (BaseQuery base : bases) {
            if (!base.distribution().clusterId().equals(clusterId)) {
                return false;
            }
        }
        return true;
    }

    private static boolean anySharded(List<BaseQuery> bases) {
        for (BaseQuery base : bases) {
            if (!base.distribution().isReplicated()) {
                return true;
            }
        }
        return false;
    }

    private static boolean compatible(BaseQuery left, BaseQuery right) {
        DistributionDescriptor l = left.distribution();
        DistributionDescriptor r = right.distribution();
        if (l.isReplicated() || r.isReplicated()) {
            return true;
        }
        return left.table().database().equals(right.table().database())
            && l.partitionCount() == r.partitionCount()
            && keyTypesMatch(l.shardKey(), r.shardKey());
    }

    private static boolean keyTypesMatch(List<KeyColumn> left, List<KeyColumn> right) {
        if (left.size() != right.size() || left.isEmpty()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!left.get(i).dataType().equals(right.get(i).dataType())) {
                return false;
            }
        }
        return true;
    }

    private static boolean joinsOnShardKey(List<ShardKey> leftKeys, List<ShardKey> rightKeys,
                                           Optional<Expression> condition) {
        if (leftKeys.isEmpty() || rightKeys.isEmpty() || condition.isEmpty()) {
            return false;
        }
        Set<List<ExprId>> equalities = new HashSet<>();
        collectEqualities(condition.get(), equalities);

        for (ShardKey l : leftKeys) {
            for (ShardKey r : rightKeys) {
                if (l.arity() == r.arity() && pairsEveryColumn(l, r, equalities)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean pairsEveryColumn(ShardKey left, ShardKey right, Set<List<ExprId>> equalities) {
        for (int i = 0; i < left.arity(); i++) {
            ExprId l = left.columns().get(i);
            ExprId r = right.columns().get(i);
            if (!equalities.contains(List.of(l, r)) && !equalities.contains(List.of(r, l))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects {@code a = b} between two column references from the top-level
     * conjuncts of a condition. Anything under OR or NOT is ignored.
     */
    private static void collectEqualities(Expression condition, Set<List<ExprId>> equalities) {
        if (!(condition instanceof BinaryExpression)) {
            return;
        }
        BinaryExpression binary = (BinaryExpression) condition;
        if (binary.operator() == BinaryExpression.Operator.AND) {
            collectEqualities(binary.left(), equalities);
            collectEqualities(binary.right(), equalities);
        } else if (binary.operator() == BinaryExpression.Operator.EQUAL
                && binary.left() instanceof AttributeReference
                && binary.right() instanceof AttributeReference) {
            equalities.add(List.of(
                ((AttributeReference) binary.left()).exprId(),
                ((AttributeReference) binary.right()).exprId()));
        }
    }
}
