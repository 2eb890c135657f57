package com.mike.scrapescheduler.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Value extracted for one field: a single text, or the texts of every matched node.
 * Serialised as a JSON string or a JSON array of strings.
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Items {

    static FieldValue text(String value) {
        return new Text(value);
    }

    static FieldValue items(List<String> values) {
        return new Items(values);
    }

    record Text(String value) implements FieldValue {
        public Text {
            if (value == null) value = "";
        }

        @Override
        @JsonValue
        public String value() {
            return value;
        }
    }

    record Items(List<String> values) implements FieldValue {
        public Items {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        @JsonValue
        public List<String> values() {
            return values;
        }
    }
}
