// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.batchapi.shim.ledger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.batchapi.core.error.StateAccessException;

/**
 * A CouchDB-style JSON selector evaluated against JSON state values.
 *
 * <p>Supported: top-level field equality ({@code {"owner":"tom"}}) and the
 * operators {@code $eq}, {@code $ne}, {@code $gt}, {@code $gte}, {@code $lt},
 * {@code $lte}. Other query members ({@code fields}, {@code sort},
 * {@code use_index}) are accepted and ignored.
 *
 * <pre>{@code
 * SelectorQuery q = SelectorQuery.parse("{\"selector\":{\"docType\":\"marble\",\"size\":{\"$gt\":10}}}");
 * q.matches("{\"docType\":\"marble\",\"size\":35}".getBytes()); // true
 * }</pre>
 */
public final class SelectorQuery {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Condition> conditions;

    private SelectorQuery(final List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /**
     * @throws StateAccessException if the query is not JSON or has no selector object
     */
    public static SelectorQuery parse(final String query) {
        Objects.requireNonNull(query, "query");
        final JsonNode root;
        try {
            root = MAPPER.readTree(query);
        } catch (JsonProcessingException e) {
            throw new StateAccessException("invalid query string: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.path("selector").isObject()) {
            throw new StateAccessException("query must be a JSON object with a \"selector\" object");
        }
        final List<Condition> conditions = new ArrayList<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = root.get("selector").fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            conditions.addAll(conditionsFor(field.getKey(), field.getValue()));
        }
        return new SelectorQuery(conditions);
    }

    /**
     * Returns whether a state value satisfies every condition. Values that are not
     * JSON objects never match.
     */
    public boolean matches(final byte[] value) {
        final JsonNode doc;
        try {
            doc = MAPPER.readTree(value);
        } catch (IOException e) {
            return false;
        }
        if (doc == null || !doc.isObject()) {
            return false;
        }
        for (Condition condition : conditions) {
            if (!condition.test(doc.get(condition.field()))) {
                return false;
            }
        }
        return true;
    }

    private static List<Condition> conditionsFor(final String field, final JsonNode operand) {
        if (!operand.isObject() || operand.isEmpty() || !operand.fieldNames().next().startsWith("$")) {
            return List.of(new Condition(field, Operator.EQ, operand));
        }
        final List<Condition> out = new ArrayList<>();
        final Iterator<Map.Entry<String, JsonNode>> ops = operand.fields();
        while (ops.hasNext()) {
            final Map.Entry<String, JsonNode> op = ops.next();
            out.add(new Condition(field, Operator.fromToken(op.getKey()), op.getValue()));
        }
        return out;
    }

    private enum Operator {
        EQ("$eq"), NE("$ne"), GT("$gt"), GTE("$gte"), LT("$lt"), LTE("$lte");

        private final String token;

        Operator(final String token) {
            this.token = token;
        }

        static Operator fromToken(final String token) {
            for (Operator op : values()) {
                if (op.token.equals(token)) {
                    return op;
                }
            }
            throw new StateAccessException("unsupported selector operator: " + token);
        }
    }

    private record Condition(String field, Operator op, JsonNode operand) {

        boolean test(final JsonNode actual) {
            if (actual == null || actual.isMissingNode()) {
                return op == Operator.NE;
            }
            return switch (op) {
                case EQ -> same(actual, operand);
                case NE -> !same(actual, operand);
                case GT -> comparable(actual, operand) && compare(actual, operand) > 0;
                case GTE -> comparable(actual, operand) && compare(actual, operand) >= 0;
                case LT -> comparable(actual, operand) && compare(actual, operand) < 0;
                case LTE -> comparable(actual, operand) && compare(actual, operand) <= 0;
            };
        }

        private static boolean same(final JsonNode a, final JsonNode b) {
            if (a.isNumber() && b.isNumber()) {
                return a.decimalValue().compareTo(b.decimalValue()) == 0;
            }
            return a.equals(b);
        }

        /** Only numbers with numbers and strings with strings are ordered. */
        private static boolean comparable(final JsonNode a, final JsonNode b) {
            return (a.isNumber() && b.isNumber()) || (a.isTextual() && b.isTextual());
        }

        private static int compare(final JsonNode a, final JsonNode b) {
            if (a.isNumber()) {
                return a.decimalValue().compareTo(b.decimalValue());
            }
            return a.textValue().compareTo(b.textValue());
        }
    }
}
