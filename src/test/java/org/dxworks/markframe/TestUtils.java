package org.dxworks.markframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.markframe.model.DocumentPrinter;
import org.dxworks.markframe.model.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /** Outline of a document as approved files store it. */
    public static String printed(Node doc) {
        return DocumentPrinter.print(doc) + "\n";
    }

    /** Compares the JSON form of {@code actual} with a JSON literal, ignoring key order. */
    public static void assertJson(String expectedJson, Object actual) {
        try {
            JsonNode expected = APPROVAL_MAPPER.readTree(expectedJson);
            JsonNode actualTree = APPROVAL_MAPPER.valueToTree(actual);
            assertEquals(expected, actualTree, () -> "JSON mismatch, actual:\n" + actualTree.toPrettyString());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid expected JSON: " + expectedJson, e);
        }
    }
}
