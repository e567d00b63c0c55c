package json.editor.core;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/// Property tests for writing edited trees back over their original text.
class SerializerPropertyTest extends JsonEditorTestBase {

    private static final List<SerializationStyle> STYLES = List.of(
            SerializationStyle.CANONICAL,
            new SerializationStyle("    ", ": ", "\n", true),
            new SerializationStyle("\t", ":", "\r\n", true),
            new SerializationStyle("  ", " : ", "\n", true),
            new SerializationStyle("", ":", "\n", false),
            new SerializationStyle("", ": ", "\n", false));

    record Edit(int pick, JsonValue value, int kind) {}

    private static Arbitrary<String> keys() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(6);
    }

    private static Arbitrary<JsonValue> values(int depth) {
        Arbitrary<JsonValue> nulls = Arbitraries.just(JsonNull.of());
        Arbitrary<JsonValue> booleans = Arbitraries.of(true, false).map(JsonBoolean::of);
        Arbitrary<JsonValue> integers = Arbitraries.longs().map(JsonInteger::of);
        Arbitrary<JsonValue> floats = Arbitraries.doubles().between(-1.0e9, 1.0e9).map(JsonFloat::of);
        Arbitrary<JsonValue> strings = Arbitraries.strings().withCharRange(' ', '~').withChars('\n', '\t', '\u00e9')
                .ofMaxLength(8).map(JsonString::of);
        Arbitrary<JsonValue> scalars = Arbitraries.oneOf(nulls, booleans, integers, floats, strings);
        if (depth <= 0) {
            return scalars;
        }
        Arbitrary<JsonValue> arrays = values(depth - 1).list().ofMaxSize(4).map(JsonArray::of);
        Arbitrary<JsonValue> objects = objects(depth - 1).map(o -> o);
        return Arbitraries.oneOf(scalars, scalars, scalars, arrays, objects);
    }

    private static Arbitrary<JsonObject> objects(int depth) {
        return Arbitraries.maps(keys(), values(depth)).ofMaxSize(4).map(JsonObject::of);
    }

    @Provide
    Arbitrary<JsonObject> documents() {
        return objects(3);
    }

    @Provide
    Arbitrary<SerializationStyle> styles() {
        return Arbitraries.of(STYLES);
    }

    @Provide
    Arbitrary<List<Edit>> edits() {
        Arbitrary<Edit> edit = Combinators.combine(
                Arbitraries.integers().between(0, 10_000),
                values(1),
                Arbitraries.integers().between(0, 3)).as(Edit::new);
        return edit.list().ofMinSize(1).ofMaxSize(5);
    }

    private static String render(JsonObject tree, SerializationStyle style) {
        String body = new JsonWriter(style, false).render(tree, "");
        return style.multiline() ? body + style.lineSeparator() : body;
    }

    @Property(tries = 200)
    void unchangedTreeIsWrittenVerbatim(@ForAll("documents") JsonObject tree, @ForAll("styles") SerializationStyle style) {
        String text = render(tree, style);
        JsonDocument doc = load(text);
        assertThat(doc.content()).isEqualTo(tree);
        assertThat(text(doc)).isEqualTo(text);
        assertThat(doc.hasChanges()).isFalse();
    }

    @Property(tries = 300)
    void editedTreeReparsesToItself(@ForAll("documents") JsonObject tree,
                                    @ForAll("styles") SerializationStyle style,
                                    @ForAll("edits") List<Edit> edits) {
        String text = render(tree, style);
        JsonDocument doc = load(text);
        for (Edit edit : edits) {
            Optional<EditOperation> op = operationFor(doc.content(), edit);
            if (op.isPresent()) {
                Optional<JsonDocument> next = doc.apply(op.get());
                assertThat(next).as("%s on %s", op.get().description(), doc.content()).isPresent();
                doc = next.orElseThrow();
            }
        }
        String written = text(doc);
        assertThat(Json.parse(written)).isEqualTo(doc.content());
        assertThat(doc.hasChanges()).isEqualTo(!written.equals(text));
    }

    @Property(tries = 50)
    void singleLeafEditChangesOneLine(@ForAll @IntRange(min = 20, max = 300) int width,
                                      @ForAll @IntRange(min = 0, max = 10_000) int pick) {
        Map<String, JsonValue> members = new LinkedHashMap<>();
        for (int i = 0; i < width; i++) {
            Map<String, JsonValue> entry = new LinkedHashMap<>();
            entry.put("id", JsonInteger.of(i));
            entry.put("name", JsonString.of("entry-" + i));
            entry.put("flags", JsonArray.of(List.of(JsonBoolean.TRUE, JsonBoolean.FALSE)));
            members.put("key" + i, JsonObject.of(entry));
        }
        String text = Json.toCanonicalString(JsonObject.of(members)) + "\n";
        JsonDocument doc = load(text);
        String target = "key" + (pick % width);
        JsonDocument edited = doc.withUpdatedValue(JsonString.of("changed"), NodePath.of(target, "name")).orElseThrow();

        String[] before = text.split("\n", -1);
        String[] after = text(edited).split("\n", -1);
        assertThat(after).hasSameSizeAs(before);
        int differing = 0;
        for (int i = 0; i < before.length; i++) {
            if (!before[i].equals(after[i])) {
                differing++;
            }
        }
        assertThat(differing).isEqualTo(1);
    }

    /// Builds an edit that applies to `tree`, or empty when the picked node
    /// offers nothing of the requested kind.
    private static Optional<EditOperation> operationFor(JsonObject tree, Edit edit) {
        List<NodePath> containers = containerPaths(tree);
        NodePath target = containers.get(edit.pick() % containers.size());
        JsonValue node = TreeEditor.resolve(tree, target).orElseThrow();
        int pick = edit.pick();
        if (node instanceof JsonObject obj) {
            List<String> keys = new ArrayList<>(obj.members().keySet());
            return switch (edit.kind()) {
                case 0 -> Optional.of(new EditOperation.AddField(target, "k" + (pick % 5), edit.value()));
                case 1 -> keys.isEmpty() ? Optional.empty()
                        : Optional.of(new EditOperation.DeleteField(target.child(keys.get(pick % keys.size()))));
                default -> keys.isEmpty() ? Optional.empty()
                        : Optional.of(new EditOperation.SetValue(target.child(keys.get(pick % keys.size())), edit.value()));
            };
        }
        JsonArray arr = (JsonArray) node;
        int size = arr.size();
        return switch (edit.kind()) {
            case 0 -> Optional.of(EditOperation.InsertArrayElement.at(target, edit.value(), pick % (size + 1)));
            case 1 -> size == 0 ? Optional.empty()
                    : Optional.of(new EditOperation.DeleteArrayElement(target.child(pick % size)));
            case 2 -> size == 0 ? Optional.empty()
                    : Optional.of(new EditOperation.SetValue(target.child(pick % size), edit.value()));
            default -> size < 2 ? Optional.empty()
                    : Optional.of(new EditOperation.MoveArrayElement(target, pick % size, (pick / size) % size));
        };
    }

    private static List<NodePath> containerPaths(JsonValue root) {
        List<NodePath> paths = new ArrayList<>();
        ArrayDeque<Map.Entry<NodePath, JsonValue>> stack = new ArrayDeque<>();
        stack.push(Map.entry(NodePath.root(), root));
        while (!stack.isEmpty()) {
            Map.Entry<NodePath, JsonValue> entry = stack.pop();
            JsonValue value = entry.getValue();
            if (value instanceof JsonObject obj) {
                paths.add(entry.getKey());
                obj.members().forEach((k, v) -> stack.push(Map.entry(entry.getKey().child(k), v)));
            } else if (value instanceof JsonArray arr) {
                paths.add(entry.getKey());
                for (int i = 0; i < arr.size(); i++) {
                    stack.push(Map.entry(entry.getKey().child(i), arr.elements().get(i)));
                }
            }
        }
        return paths;
    }
}
