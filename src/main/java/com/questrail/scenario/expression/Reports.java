package com.questrail.scenario.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes of the diagnostic report tree.
 */
final class Reports
{
    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Reports() {}

    /**
     * Report of a node that contributes no named entry: {@code [ {} ]}.
     */
    static ArrayNode emptyEntry() {
        ArrayNode result = NODES.arrayNode();
        result.addObject();
        return result;
    }

    /**
     * Report of a combinator. Named child reports are appended as they are;
     * child arrays are spliced into this one.
     */
    static ArrayNode collect(String prefix, String type, int occurrence, List<Expression> operands) {
        if (operands.isEmpty()) {
            return emptyEntry();
        }

        String childPrefix = prefix + type + "(" + occurrence + ")/";
        Map<String, Integer> occurrences = new HashMap<>();

        ArrayNode result = NODES.arrayNode();
        for (Expression operand : operands) {
            int nth = occurrences.merge(operand.type(), 1, Integer::sum) - 1;
            JsonNode property = operand.property(childPrefix, nth);
            if (property.has("Name")) {
                result.add(property);
            } else {
                property.forEach(result::add);
            }
        }
        return result;
    }
}
