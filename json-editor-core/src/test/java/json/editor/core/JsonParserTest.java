package json.editor.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonParserTest extends JsonEditorTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testParseComplexJson() {
        JsonObject jsonObject = (JsonObject) Json.parse("""
                {
                    "name": "John Doe",
                    "age": 30,
                    "isStudent": false,
                    "gpa": 3.5,
                    "nickname": null,
                    "courses": [
                        {"title": "History", "credits": 3},
                        {"title": "Math", "credits": 4}
                    ]
                }
                """);

        assertThat(jsonObject.get("name")).isEqualTo(JsonString.of("John Doe"));
        assertThat(jsonObject.get("age")).isEqualTo(JsonInteger.of(30));
        assertThat(jsonObject.get("isStudent")).isEqualTo(JsonBoolean.FALSE);
        assertThat(jsonObject.get("gpa")).isEqualTo(JsonFloat.of(3.5));
        assertThat(jsonObject.get("nickname")).isEqualTo(JsonNull.of());

        JsonArray courses = (JsonArray) jsonObject.get("courses");
        assertThat(courses.elements()).hasSize(2);
        JsonObject course2 = (JsonObject) courses.elements().get(1);
        assertThat(course2.get("title")).isEqualTo(JsonString.of("Math"));
        assertThat(course2.get("credits")).isEqualTo(JsonInteger.of(4));
    }

    @Test
    void membersKeepSourceOrder() {
        JsonObject obj = (JsonObject) Json.parse("{\"zeta\":1,\"alpha\":2,\"mid\":3}");
        assertThat(obj.members().keySet()).containsExactly("zeta", "alpha", "mid");
    }

    @Test
    void objectEqualityIgnoresMemberOrder() {
        assertThat(Json.parse("{\"a\":1,\"b\":[1,2]}")).isEqualTo(Json.parse("{\"b\":[1,2],\"a\":1}"));
        assertThat(Json.parse("[1,2]")).isNotEqualTo(Json.parse("[2,1]"));
    }

    @Test
    void numbersSplitIntoIntegersAndFloats() {
        assertThat(Json.parse("-0")).isEqualTo(JsonInteger.of(0));
        assertThat(Json.parse("9223372036854775807")).isEqualTo(JsonInteger.of(Long.MAX_VALUE));
        assertThat(Json.parse("9223372036854775808")).isEqualTo(JsonFloat.of(9.223372036854775808E18));
        assertThat(Json.parse("2.0")).isEqualTo(JsonFloat.of(2.0));
        assertThat(Json.parse("1e3")).isEqualTo(JsonFloat.of(1000.0));
        assertThat(Json.parse("-1.5E-2")).isEqualTo(JsonFloat.of(-0.015));
    }

    @Test
    void stringEscapesAreDecoded() {
        JsonValue value = Json.parse("\"tab\\tquote\\\"slash\\/u\\u00e9\\n\"");
        assertThat(value).isEqualTo(JsonString.of("tab\tquote\"slash/u\u00e9\n"));
        assertThat(value.toString()).isEqualTo("\"tab\\tquote\\\"slash/u\u00e9\\n\"");
    }

    @Test
    void duplicateMemberNamesAreRejectedWithLocation() {
        assertThatThrownBy(() -> Json.parse("{\n  \"a\": 1,\n  \"a\": 2\n}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Duplicate member name \"a\"")
                .satisfies(e -> {
                    JsonParseException pe = (JsonParseException) e;
                    assertThat(pe.line()).isEqualTo(3);
                    assertThat(pe.column()).isEqualTo(3);
                    assertThat(pe.offset()).isEqualTo(14);
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "", "{", "{\"a\"}", "{\"a\":1,}", "[1,]", "[01]", "1.", "-", "tru", "\"unterminated",
            "\"bad \\x escape\"", "{\"a\":1} trailing", "'single'", "{a:1}", "[1 2]", "1e400"
    })
    void malformedTextIsRejected(String text) {
        assertThatThrownBy(() -> Json.parse(text)).isInstanceOf(JsonParseException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"a\":\"\\u\u0660\u0660\u0664\u0661\"}",
            "{\"a\":\"\\u\uFF10\uFF10\uFF14\uFF11\"}",
            "{\"a\":\"\\u00g1\"}"
    })
    void unicodeEscapeAcceptsOnlyAsciiHexDigits(String text) {
        assertThatThrownBy(() -> Json.parse(text))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Invalid unicode escape");
        assertThatThrownBy(() -> load(text)).isInstanceOf(InvalidJsonException.class);
    }

    @Test
    void unicodeEscapeAcceptsMixedCaseHex() {
        assertThat(Json.parse("\"\\u00e9\\u00C9\"")).isEqualTo(JsonString.of("\u00e9\u00c9"));
    }

    @Test
    void rawControlCharacterInStringIsRejected() {
        assertThatThrownBy(() -> Json.parse("\"a\u0001b\""))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("control character");
    }

    @Test
    void byteOrderMarkIsAcceptedAndKeptInPrefix() {
        SourceTree tree = JsonParser.parseTracked("\uFEFF {\"a\":1}\n");
        assertThat(tree.root().value()).isEqualTo(Json.parse("{\"a\":1}"));
        assertThat(tree.prefix()).isEqualTo("\uFEFF ");
        assertThat(tree.suffix()).isEqualTo("\n");
    }

    @Test
    void excessiveNestingIsRejected() {
        String deep = "[".repeat(JsonParser.MAX_DEPTH + 1) + "]".repeat(JsonParser.MAX_DEPTH + 1);
        assertThatThrownBy(() -> Json.parse(deep))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Nesting deeper than");
        String allowed = "[".repeat(JsonParser.MAX_DEPTH) + "]".repeat(JsonParser.MAX_DEPTH);
        assertThat(Json.parse(allowed)).isInstanceOf(JsonArray.class);
    }

    @Test
    void spansCoverTheSourceText() {
        String text = "{ \"k\" : [1, \"two\"] }";
        SourceTree tree = JsonParser.parseTracked(text);
        SourceNode.ObjectNode root = (SourceNode.ObjectNode) tree.root();
        SourceNode.MemberNode member = root.members().get(0);
        assertThat(text.substring(member.keyStart(), member.keyEnd())).isEqualTo("\"k\"");
        assertThat(text.substring(member.keyEnd(), member.value().start())).isEqualTo(" : ");
        SourceNode.ArrayNode array = (SourceNode.ArrayNode) member.value();
        assertThat(text.substring(array.start(), array.end())).isEqualTo("[1, \"two\"]");
        SourceNode second = array.elements().get(1);
        assertThat(text.substring(second.start(), second.end())).isEqualTo("\"two\"");
    }

    @Test
    void agreesWithJackson() throws Exception {
        String text = """
                {"name":"caf\\u00e9","list":[1,-2,3.25,1.5e3,true,null,{"x":[]}],
                 "big":12345678901234567890,"nested":{"deep":{"deeper":"\\"q\\""}}}
                """;
        Object untyped = MAPPER.readValue(text, Object.class);
        assertThat(Json.parse(text)).isEqualTo(Json.fromUntyped(untyped));
    }

    @Test
    void untypedConversionRoundTrips() {
        Map<String, Object> data = Map.of("active", true, "count", 42, "ratio", 0.5,
                "tags", List.of("a", "b"));
        JsonValue json = Json.fromUntyped(data);
        assertThat(json).isEqualTo(Json.parse("{\"active\":true,\"count\":42,\"ratio\":0.5,\"tags\":[\"a\",\"b\"]}"));
        assertThat(Json.fromUntyped(Json.toUntyped(json))).isEqualTo(json);
    }

    @Test
    void canonicalStringSortsAndIndents() {
        JsonValue json = Json.parse("{\"scores\":[85,90],\"name\":\"Alice\",\"empty\":{}}");
        assertThat(Json.toCanonicalString(json)).isEqualTo("""
                {
                  "empty": {},
                  "name": "Alice",
                  "scores": [
                    85,
                    90
                  ]
                }""");
    }

    @Test
    void nonFiniteNumbersAreNotRepresentable() {
        JsonObject withNan = JsonObject.of(Map.of("x", JsonArray.of(List.of(JsonFloat.of(Double.NaN)))));
        assertThat(Json.isRepresentable(withNan)).isFalse();
        assertThat(Json.isRepresentable(Json.parse("[1.5, {\"y\": -2}]"))).isTrue();
        assertThatThrownBy(() -> Json.toCanonicalString(withNan)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quoteEscapesControlCharactersAndLoneSurrogates() {
        assertThat(JsonWriter.quote("a\u0001\"\\")).isEqualTo("\"a\\u0001\\\"\\\\\"");
        assertThat(JsonWriter.quote("\uD83D\uDE00")).isEqualTo("\"\uD83D\uDE00\"");
        assertThat(JsonWriter.quote("x\uD83Dy")).isEqualTo("\"x\\ud83dy\"");
        assertThat(Json.parse(JsonWriter.quote("x\uD83Dy"))).isEqualTo(JsonString.of("x\uD83Dy"));
    }
}
