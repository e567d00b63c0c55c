package json.editor.core;

import java.util.List;

/// A parsed value together with the character range it occupies in the
/// text it was parsed from. `start` is inclusive and `end` exclusive.
sealed interface SourceNode permits SourceNode.ScalarNode, SourceNode.ArrayNode, SourceNode.ObjectNode {

    JsonValue value();

    int start();

    int end();

    record ScalarNode(JsonValue value, int start, int end) implements SourceNode {
    }

    record ArrayNode(JsonArray value, int start, int end, List<SourceNode> elements) implements SourceNode {
        public ArrayNode {
            elements = List.copyOf(elements);
        }
    }

    record ObjectNode(JsonObject value, int start, int end, List<MemberNode> members) implements SourceNode {
        public ObjectNode {
            members = List.copyOf(members);
        }
    }

    /// One `"key": value` pair. `keyStart` is the opening quote of the key and
    /// `keyEnd` is just past its closing quote.
    record MemberNode(String key, int keyStart, int keyEnd, SourceNode value) {
    }
}
