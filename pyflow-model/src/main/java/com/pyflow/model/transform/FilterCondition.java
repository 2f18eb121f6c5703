package com.pyflow.model.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/** Row condition of a filter step, e.g. {@code (age, greater_than, 18)}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterCondition(String column, String operator, Object value) {

    @JsonCreator
    public FilterCondition(@JsonProperty("column") String column,
                           @JsonProperty("operator") String operator,
                           @JsonProperty("value") Object value) {
        this.column = column != null ? column : "";
        this.operator = operator != null && !operator.isBlank() ? operator : "equals";
        this.value = value;
    }

    /** Formula text for a FilterOnFormula step, e.g. {@code age > 18}. */
    public String toFormula() {
        String op = switch (operator.toLowerCase(Locale.ROOT)) {
            case "equals", "eq", "==" -> "==";
            case "not_equals", "ne", "!=" -> "!=";
            case "greater_than", "gt", ">" -> ">";
            case "greater_than_or_equal", "greater_or_equal", "gte", "ge", ">=" -> ">=";
            case "less_than", "lt", "<" -> "<";
            case "less_than_or_equal", "less_or_equal", "lte", "le", "<=" -> "<=";
            case "is_null", "isnull", "is_empty" -> "isEmpty";
            case "not_null", "notnull", "is_not_empty" -> "!isEmpty";
            default -> operator;
        };
        if (op.equals("isEmpty")) return "isBlank(" + column + ")";
        if (op.equals("!isEmpty")) return "!isBlank(" + column + ")";
        Object rendered = value instanceof String s ? "'" + s + "'" : value;
        return column + " " + op + " " + rendered;
    }
}
