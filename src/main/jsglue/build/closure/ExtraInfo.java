package jsglue.build.closure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Map;

/**
 * The JSON payload the toolchain appends to the glue code as a trailing comment:
 * <p>
 * // EXTRA_INFO:{"mapping": {...}, "exports": [["_foo", "foo"]], "globals": ..., "unused": [...]}
 * <p>
 * "globals" is a list of names when preparing minifyGlobals and a name to minified name object
 * when used by minifyLocals.
 */
public class ExtraInfo {
    public static final String MARKER = "// EXTRA_INFO:";

    public static class ExportName {
        final String name;
        final String binaryName;

        public ExportName(String name, String binaryName) {
            this.name = name;
            this.binaryName = binaryName;
        }

        public String getName() {
            return name;
        }

        public String getBinaryName() {
            return binaryName;
        }
    }

    private final ImmutableMap<String, String> mapping;
    private final ImmutableList<ExportName> exports;
    private final ImmutableList<String> globalNames;
    private final ImmutableMap<String, String> globalMapping;
    private final ImmutableSet<String> unused;

    ExtraInfo(
            ImmutableMap<String, String> mapping,
            ImmutableList<ExportName> exports,
            ImmutableList<String> globalNames,
            ImmutableMap<String, String> globalMapping,
            ImmutableSet<String> unused) {
        this.mapping = mapping;
        this.exports = exports;
        this.globalNames = globalNames;
        this.globalMapping = globalMapping;
        this.unused = unused;
    }

    public ImmutableMap<String, String> getMapping() {
        return mapping;
    }

    public ImmutableList<ExportName> getExports() {
        return exports;
    }

    public ImmutableList<String> getGlobalNames() {
        return globalNames;
    }

    /**
     * null unless "globals" was given as an object
     */
    public ImmutableMap<String, String> getGlobalMapping() {
        return globalMapping;
    }

    public ImmutableSet<String> getUnused() {
        return unused;
    }

    /**
     * @return null if the source carries no payload
     */
    public static ExtraInfo fromSource(String source) {
        int start = source.lastIndexOf(MARKER);
        if (start <= 0) {
            return null;
        }
        return parse(source.substring(start + MARKER.length()));
    }

    public static ExtraInfo parse(String json) {
        try {
            JsonObject obj = JsonParser.parseString(json).getAsJsonObject();

            ImmutableMap<String, String> mapping = ImmutableMap.of();
            if (obj.has("mapping")) {
                mapping = stringMap(obj.getAsJsonObject("mapping"));
            }

            ImmutableList.Builder<ExportName> exports = ImmutableList.builder();
            if (obj.has("exports")) {
                for (JsonElement e : obj.getAsJsonArray("exports")) {
                    JsonArray pair = e.getAsJsonArray();
                    if (pair.size() != 2) {
                        throw new IllegalArgumentException("export entries must be [name, binaryName] pairs, got " + pair);
                    }
                    exports.add(new ExportName(pair.get(0).getAsString(), pair.get(1).getAsString()));
                }
            }

            ImmutableList<String> globalNames = ImmutableList.of();
            ImmutableMap<String, String> globalMapping = null;
            if (obj.has("globals")) {
                JsonElement globals = obj.get("globals");
                if (globals.isJsonArray()) {
                    globalNames = stringList(globals.getAsJsonArray());
                } else {
                    globalMapping = stringMap(globals.getAsJsonObject());
                }
            }

            ImmutableSet<String> unused = ImmutableSet.of();
            if (obj.has("unused")) {
                unused = ImmutableSet.copyOf(stringList(obj.getAsJsonArray("unused")));
            }

            return new ExtraInfo(mapping, exports.build(), globalNames, globalMapping, unused);
        } catch (JsonParseException | IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            throw new IllegalArgumentException("malformed " + MARKER + " payload: " + e.getMessage(), e);
        }
    }

    private static ImmutableMap<String, String> stringMap(JsonObject obj) {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            builder.put(e.getKey(), e.getValue().getAsString());
        }
        return builder.build();
    }

    private static ImmutableList<String> stringList(JsonArray array) {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (JsonElement e : array) {
            builder.add(e.getAsString());
        }
        return builder.build();
    }
}
