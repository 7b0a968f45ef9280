/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.dataapi.driver.values;

import static io.dataapi.driver.util.CheckNull.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;

import io.dataapi.driver.JsonParseException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Utility methods to parse JSON into {@link FieldValue} instances and to
 * produce the canonical text of a value. Parsing uses the Jackson streaming
 * parser.
 * <p>
 * Numbers are mapped to the smallest type that holds them: int, long,
 * double, or {@link NumberValue} for values beyond double precision. An
 * object of the form <code>{"$date": number}</code> is mapped to a
 * {@link TimestampValue}.
 */
public class JsonUtils {

    protected static final JsonFactory factory = new JsonFactory();

    /**
     * Returns true if the two JSON strings represent equal values.
     *
     * @param s1 a JSON string
     * @param s2 a JSON string
     *
     * @return true if the values are equal
     */
    public static boolean jsonEquals(String s1, String s2) {
        FieldValue v1 = createValueFromJson(s1);
        FieldValue v2 = createValueFromJson(s2);
        return v1.equals(v2);
    }

    /**
     * Constructs a FieldValue from a JSON string.
     *
     * @param jsonInput the JSON text
     *
     * @return the value
     *
     * @throws JsonParseException if the input is not valid JSON
     */
    public static FieldValue createValueFromJson(String jsonInput) {
        requireNonNull(jsonInput,
                       "createValueFromJson: jsonInput must be non-null");

        try (JsonParser jp = factory.createParser(jsonInput)) {
            return createValueFromJson(jp, true);
        } catch (IOException ioe) {
            throw new JsonParseException("JSON parse failed: " +
                                         ioe.getMessage());
        }
    }

    /**
     * Constructs a FieldValue from JSON read from a stream.
     *
     * @param jsonInput the stream
     *
     * @return the value
     *
     * @throws JsonParseException if the input is not valid JSON
     */
    public static FieldValue createValueFromJson(InputStream jsonInput) {
        requireNonNull(jsonInput,
                       "createValueFromJson: jsonInput must be non-null");

        try (JsonParser jp = factory.createParser(jsonInput)) {
            return createValueFromJson(jp, true);
        } catch (IOException ioe) {
            throw new JsonParseException("JSON parse failed: " +
                                         ioe.getMessage());
        }
    }

    static FieldValue createValueFromJson(JsonParser jp, boolean getNext) {

        try {
            JsonToken token = (getNext ? jp.nextToken() : jp.currentToken());
            if (token == null) {
                throw createParseException("Empty JSON", jp);
            }

            switch (token) {
            case VALUE_STRING:
                return new StringValue(jp.getText());
            case VALUE_NUMBER_INT:
            case VALUE_NUMBER_FLOAT:
                JsonParser.NumberType numberType = jp.getNumberType();

                switch (numberType) {
                case BIG_INTEGER:
                case BIG_DECIMAL:
                    return new NumberValue(jsonParserGetDecimalValue(jp));
                case INT:
                    return new IntegerValue(jp.getIntValue());
                case LONG:
                    return new LongValue(jp.getLongValue());
                case FLOAT:
                case DOUBLE:
                    double dbl = jp.getDoubleValue();
                    /*
                     * An infinite double means the text is beyond double
                     * range; keep the exact value.
                     */
                    if (Double.isInfinite(dbl)) {
                        return new NumberValue(jsonParserGetDecimalValue(jp));
                    }
                    return new DoubleValue(dbl);
                default:
                    throw createParseException("Unexpected numeric type: " +
                                               numberType, jp);
                }
            case VALUE_TRUE:
                return BooleanValue.trueInstance();
            case VALUE_FALSE:
                return BooleanValue.falseInstance();
            case VALUE_NULL:
                return JsonNullValue.getInstance();
            case START_OBJECT:
                return parseObject(jp);
            case START_ARRAY:
                return parseArray(jp);
            default:
                throw createParseException(
                    "Unexpected token while parsing JSON: " + token, jp);
            }
        } catch (IOException ioe) {
            throw createParseException(
                "Failed to parse JSON input: " + ioe.getMessage(), jp);
        }
    }

    private static FieldValue parseObject(JsonParser jp)
        throws IOException {

        MapValue map = new MapValue();

        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            String fieldName = jp.currentName();
            if (token == null || fieldName == null) {
                throw createParseException(
                    "null token or field name parsing JSON object", jp);
            }

            /* true tells the method to fetch the next token */
            FieldValue field = createValueFromJson(jp, true);
            map.put(fieldName, field);
        }
        return asTimestamp(map);
    }

    /*
     * {"$date": number} is the extended JSON form of a timestamp
     */
    private static FieldValue asTimestamp(MapValue map) {
        if (map.size() == 1) {
            FieldValue date = map.get(TimestampValue.DATE_FIELD);
            if (date != null && (date.isInteger() || date.isLong())) {
                return new TimestampValue(date.getLong());
            }
        }
        return map;
    }

    private static FieldValue parseArray(JsonParser jp)
        throws IOException {

        ArrayValue array = new ArrayValue();

        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_ARRAY) {
            if (token == null) {
                throw createParseException(
                    "null token while parsing JSON array", jp);
            }

            /* false means don't get the next token, it's been fetched */
            array.add(createValueFromJson(jp, false));
        }
        return array;
    }

    static BigDecimal jsonParserGetDecimalValue(JsonParser parser)
        throws IOException {

        try {
            return parser.getDecimalValue();
        } catch (NumberFormatException nfe) {
            throw createParseException("Malformed numeric value: '" +
                                       parser.getText() + ": " +
                                       nfe.getMessage(), parser);
        }
    }

    private static JsonParseException createParseException(String msg,
                                                           JsonParser jp) {
        return new JsonParseException(msg,
                                      jp == null ? null :
                                      jp.currentLocation());
    }

    /**
     * Returns the canonical JSON text of a value: map keys sorted and
     * numbers normalized, so that values which are structurally equal,
     * regardless of field order or numeric representation, have equal text.
     *
     * @param value the value
     *
     * @return the canonical text
     */
    public static String toCanonicalJson(FieldValue value) {
        requireNonNull(value, "toCanonicalJson: value must be non-null");
        CanonicalJsonSerializer cs = new CanonicalJsonSerializer();
        cs.write(value);
        return cs.toString();
    }
}
