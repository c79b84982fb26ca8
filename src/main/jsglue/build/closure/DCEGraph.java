package jsglue.build.closure;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Collection;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The reachability graph handed to wasm-metadce. Nodes and edges are kept sorted so the same input
 * always serializes to the same text.
 */
public class DCEGraph {

    public static final String PREFIX = "emcc$";

    public enum Kind {
        IMPORT("import"),
        EXPORT("export"),
        DEFUN("defun");

        final String label;

        Kind(String label) {
            this.label = label;
        }

        public String graphName(String name) {
            return PREFIX + label + "$" + name;
        }
    }

    public static class GraphNode {
        final String name;
        final Kind kind;
        // ["env", name] for imports
        final String importName;
        // the name the binary exports, for exports
        final String exportName;
        final SortedSet<String> reaches = new TreeSet<>();
        boolean root = false;

        GraphNode(String name, Kind kind, String importName, String exportName) {
            this.name = name;
            this.kind = kind;
            this.importName = importName;
            this.exportName = exportName;
        }

        public String getName() {
            return name;
        }

        public Kind getKind() {
            return kind;
        }

        public SortedSet<String> getReaches() {
            return reaches;
        }

        public boolean isRoot() {
            return root;
        }

        public void addReach(String target) {
            reaches.add(target);
        }

        public void setRoot() {
            root = true;
        }

        JsonObject toJson() {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", name);
            if (importName != null) {
                JsonArray imp = new JsonArray();
                imp.add("env");
                imp.add(importName);
                obj.add("import", imp);
            }
            if (exportName != null) {
                obj.addProperty("export", exportName);
            }
            JsonArray arr = new JsonArray();
            for (String r : reaches) {
                arr.add(r);
            }
            obj.add("reaches", arr);
            if (root) {
                obj.addProperty("root", true);
            }
            return obj;
        }
    }

    private final Map<String, GraphNode> nodes = new TreeMap<>();

    public GraphNode addImport(String name) {
        return add(new GraphNode(Kind.IMPORT.graphName(name), Kind.IMPORT, name, null));
    }

    public GraphNode addExport(String graphName, String binaryName) {
        return add(new GraphNode(graphName, Kind.EXPORT, null, binaryName));
    }

    public GraphNode addDefun(String name) {
        return add(new GraphNode(Kind.DEFUN.graphName(name), Kind.DEFUN, null, null));
    }

    private GraphNode add(GraphNode node) {
        // a later registration of the same name replaces the earlier one, like a JS object would
        nodes.put(node.name, node);
        return node;
    }

    /**
     * @return null if there is no such node
     */
    public GraphNode get(String graphName) {
        return nodes.get(graphName);
    }

    public Collection<GraphNode> getNodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    public JsonArray toJson() {
        JsonArray arr = new JsonArray();
        for (GraphNode node : nodes.values()) {
            arr.add(node.toJson());
        }
        return arr;
    }

    public String print() {
        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .create();
        return gson.toJson(toJson());
    }
}
