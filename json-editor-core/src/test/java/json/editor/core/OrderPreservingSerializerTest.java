package json.editor.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrderPreservingSerializerTest extends JsonEditorTestBase {

    private static final String CONFIG = """
            {
              "name": "app",
              "version": 1,
              "tags": ["a", "b"],
              "features": {
                "darkMode": {
                  "enabled": false
                }
              }
            }
            """;

    private static String write(JsonValue tree, String original) {
        return OrderPreservingSerializer.serialize(tree, original).orElseThrow();
    }

    private static JsonValue edit(String original, EditOperation op) {
        return op.apply(Json.parse(original)).orElseThrow();
    }

    @Test
    void unchangedTreeIsWrittenByteForByte() {
        String odd = "\uFEFF  {\"b\" :1 ,\n\t\"a\":[ 1,2 ] , \"c\":{ }}\r\n";
        assertThat(write(Json.parse(odd), odd)).isEqualTo(odd);
        assertThat(write(Json.parse(CONFIG), CONFIG)).isEqualTo(CONFIG);
    }

    @Test
    void changedLeafOnlyRewritesItsValue() {
        JsonValue tree = edit(CONFIG, new EditOperation.SetValue(NodePath.of("features", "darkMode", "enabled"), JsonBoolean.TRUE));
        assertThat(write(tree, CONFIG)).isEqualTo(CONFIG.replace("false", "true"));
    }

    @Test
    void newKeyIsAppendedInSiblingLayout() {
        JsonValue tree = edit(CONFIG, new EditOperation.AddField(NodePath.of("features", "darkMode"), "rollout", JsonInteger.of(50)));
        assertThat(write(tree, CONFIG)).isEqualTo("""
                {
                  "name": "app",
                  "version": 1,
                  "tags": ["a", "b"],
                  "features": {
                    "darkMode": {
                      "enabled": false,
                      "rollout": 50
                    }
                  }
                }
                """);
    }

    @Test
    void newContainerValueIsIndentedForItsLine() {
        Map<String, JsonValue> owner = new LinkedHashMap<>();
        owner.put("team", JsonString.of("core"));
        owner.put("ids", JsonArray.of(List.of(JsonInteger.of(1), JsonInteger.of(2))));
        JsonValue tree = edit(CONFIG, new EditOperation.AddField(NodePath.root(), "owner", JsonObject.of(owner)));
        assertThat(write(tree, CONFIG)).isEqualTo("""
                {
                  "name": "app",
                  "version": 1,
                  "tags": ["a", "b"],
                  "features": {
                    "darkMode": {
                      "enabled": false
                    }
                  },
                  "owner": {
                    "team": "core",
                    "ids": [
                      1,
                      2
                    ]
                  }
                }
                """);
    }

    @Test
    void deletedKeyTakesItsLineWithIt() {
        JsonValue tree = edit(CONFIG, new EditOperation.DeleteField(NodePath.of("version")));
        assertThat(write(tree, CONFIG)).isEqualTo(CONFIG.replace("  \"version\": 1,\n", ""));
    }

    @Test
    void deletingTheLastKeyKeepsTheClosingLayout() {
        JsonValue tree = edit(CONFIG, new EditOperation.DeleteField(NodePath.of("features")));
        assertThat(write(tree, CONFIG)).isEqualTo("""
                {
                  "name": "app",
                  "version": 1,
                  "tags": ["a", "b"]
                }
                """);
    }

    @Test
    void inlineArrayStaysInline() {
        JsonValue tree = edit(CONFIG, EditOperation.InsertArrayElement.append(NodePath.of("tags"), JsonString.of("c")));
        assertThat(write(tree, CONFIG)).isEqualTo(CONFIG.replace("[\"a\", \"b\"]", "[\"a\", \"b\", \"c\"]"));
    }

    @Test
    void movedElementKeepsNeighboursVerbatim() {
        String original = """
                {
                  "order": [
                    "one",
                    "two",
                    "three",
                    "four"
                  ]
                }""";
        JsonValue tree = edit(original, new EditOperation.MoveArrayElement(NodePath.of("order"), 0, 2));
        assertThat(write(tree, original)).isEqualTo("""
                {
                  "order": [
                    "two",
                    "three",
                    "one",
                    "four"
                  ]
                }""");
    }

    @Test
    void editInsideArrayElementDescendsIntoIt() {
        String original = """
                {
                  "rules": [
                    {"id": 1, "on": true},
                    {"id": 2, "on": false},
                    {"id": 3, "on": true}
                  ]
                }
                """;
        JsonValue tree = edit(original, new EditOperation.SetValue(NodePath.of("rules", "1", "on"), JsonBoolean.TRUE));
        assertThat(write(tree, original)).isEqualTo(original.replace("\"id\": 2, \"on\": false", "\"id\": 2, \"on\": true"));
    }

    @Test
    void compactDocumentStaysCompact() {
        String original = "{\"a\":1,\"b\":[true]}";
        JsonValue tree = edit(original, new EditOperation.AddField(NodePath.root(), "c", Json.parse("{\"d\":[1,2]}")));
        assertThat(write(tree, original)).isEqualTo("{\"a\":1,\"b\":[true],\"c\":{\"d\":[1,2]}}");
    }

    @Test
    void tabsAndCrlfAreFollowed() {
        String original = "{\r\n\t\"a\": {\r\n\t\t\"x\": 1\r\n\t}\r\n}\r\n";
        JsonValue tree = edit(original, new EditOperation.AddField(NodePath.root(), "b", Json.parse("{\"y\":2}")));
        assertThat(write(tree, original))
                .isEqualTo("{\r\n\t\"a\": {\r\n\t\t\"x\": 1\r\n\t},\r\n\t\"b\": {\r\n\t\t\"y\": 2\r\n\t}\r\n}\r\n");
    }

    @Test
    void singleMemberObjectGrowsWithLeadingWhitespace() {
        String original = "{\n    \"only\": true\n}";
        JsonValue tree = edit(original, new EditOperation.AddField(NodePath.root(), "next", JsonNull.of()));
        assertThat(write(tree, original)).isEqualTo("{\n    \"only\": true,\n    \"next\": null\n}");
    }

    @Test
    void emptyContainerIsFilledFresh() {
        String original = "{\n  \"extra\": {},\n  \"list\": []\n}";
        JsonValue tree = edit(original, new EditOperation.AddField(NodePath.of("extra"), "k", JsonInteger.of(1)));
        tree = EditOperation.InsertArrayElement.append(NodePath.of("list"), JsonString.of("v")).apply(tree).orElseThrow();
        assertThat(write(tree, original)).isEqualTo("{\n  \"extra\": {\n    \"k\": 1\n  },\n  \"list\": [\n    \"v\"\n  ]\n}");
    }

    @Test
    void typeChangeRewritesOnlyThatValue() {
        String original = "{\n  \"a\": \"text\",\n  \"b\": 2\n}";
        JsonValue tree = edit(original, new EditOperation.SetValue(NodePath.of("a"), Json.parse("[1]")));
        assertThat(write(tree, original)).isEqualTo("{\n  \"a\": [\n    1\n  ],\n  \"b\": 2\n}");
    }

    @Test
    void equalNumbersKeepTheirSpelling() {
        String original = "{\"n\": 1.50, \"m\": 1e2}";
        JsonValue tree = edit(original, new EditOperation.SetValue(NodePath.of("m"), JsonFloat.of(100.0)));
        assertThat(write(tree, original)).isEqualTo(original);
    }

    @Test
    void withoutOriginalTextTheCanonicalFormIsUsed() {
        JsonValue tree = Json.parse("{\"b\":[1,{\"z\":null,\"y\":true}],\"a\":\"x\"}");
        assertThat(OrderPreservingSerializer.serialize(tree, (String) null)).contains("""
                {
                  "a": "x",
                  "b": [
                    1,
                    {
                      "y": true,
                      "z": null
                    }
                  ]
                }""");
    }

    @Test
    void malformedOriginalFallsBackToCanonical() {
        JsonValue tree = Json.parse("{\"b\":1,\"a\":2}");
        assertThat(OrderPreservingSerializer.serialize(tree, "{not json")).contains("{\n  \"a\": 2,\n  \"b\": 1\n}");
    }

    @Test
    void nonFiniteNumberCannotBeWritten() {
        JsonValue tree = JsonObject.of(Map.of("x", JsonFloat.of(Double.POSITIVE_INFINITY)));
        assertThat(OrderPreservingSerializer.serialize(tree, "{\"x\":1}")).isEmpty();
        assertThat(OrderPreservingSerializer.canonical(tree)).isEmpty();
    }

    @Test
    void largeArraysFallBackToPositionalPairing() {
        int size = 1100;
        List<JsonValue> values = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            values.add(JsonInteger.of(i));
        }
        String original = JsonObject.of(Map.of("big", JsonArray.of(values))).toString();
        values.set(500, JsonString.of("changed"));
        JsonValue tree = JsonObject.of(Map.of("big", JsonArray.of(values)));
        String written = write(tree, original);
        assertThat(written).isEqualTo(original.replace(",500,", ",\"changed\","));
        assertThat(Json.parse(written)).isEqualTo(tree);
    }

    @Test
    void styleDetection() {
        assertThat(SerializationStyle.detect(CONFIG)).isEqualTo(new SerializationStyle("  ", ": ", "\n", true));
        assertThat(SerializationStyle.detect("{\r\n\t\"a\" : 1\r\n}"))
                .isEqualTo(new SerializationStyle("\t", " : ", "\r\n", true));
        assertThat(SerializationStyle.detect("{\"a\":1}")).isEqualTo(new SerializationStyle("  ", ":", "\n", false));
        assertThat(SerializationStyle.detect("[]")).isEqualTo(new SerializationStyle("  ", ": ", "\n", false));
    }
}
