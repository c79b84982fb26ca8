package jsglue.build.closure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.rhino.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Runs passes over glue code, in the order given
 * <p>
 * GlueOptimizer infile.js JSDCE minifyWhitespace
 * <p>
 * prints the result (or the graph, for emitDCEGraph) to stdout.
 */
public class GlueOptimizer {
    private static final Logger LOG = LoggerFactory.getLogger(GlueOptimizer.class);

    public interface PassFactory {
        CompilerPass create(Compiler cc, OptimizerContext context);
    }

    public static final ImmutableMap<String, PassFactory> PASSES = ImmutableMap.<String, PassFactory>builder()
            .put("JSDCE", (cc, context) -> new JsDeadCodeElimination(false))
            .put("AJSDCE", (cc, context) -> new JsDeadCodeElimination(true))
            .put("applyImportAndExportNameChanges", ApplyImportAndExportNameChanges::new)
            .put("emitDCEGraph", (cc, context) -> new EmitDCEGraph(context))
            .put("applyDCEGraphRemovals", (cc, context) -> new ApplyDCEGraphRemovals(context))
            .put("minifyLocals", (cc, context) -> new MinifyLocals(context))
            .put("minifyGlobals", (cc, context) -> new MinifyGlobals(context))
            .put("minifyWhitespace", (cc, context) -> (externs, root) -> context.setMinifyWhitespace(true))
            .put("noPrint", (cc, context) -> (externs, root) -> context.setNoPrint(true))
            .put("verbose", (cc, context) -> (externs, root) -> context.setVerbose(true))
            // accepted for older drivers, does nothing
            .put("last", (cc, context) -> (externs, root) -> {
            })
            .put("dump", (cc, context) -> (externs, root) -> context.out().println(root.toStringTree()))
            .build();

    static void checkPasses(List<String> passes) {
        for (String pass : passes) {
            if (!PASSES.containsKey(pass)) {
                throw new IllegalArgumentException("unknown pass: " + pass + ", known passes are " + PASSES.keySet());
            }
        }
    }

    /**
     * parses input, runs the passes and prints to out
     */
    public static void run(String name, String input, List<String> passes, PrintStream out) {
        // no point in parsing when we can't finish
        checkPasses(passes);

        ExtraInfo extraInfo = ExtraInfo.fromSource(input);
        OptimizerContext context = new OptimizerContext(extraInfo, out);

        Compiler cc = ParserHelper.createCompiler();
        Node root = ParserHelper.parse(cc, name, input);

        for (String pass : passes) {
            LOG.debug("running {}", pass);
            PASSES.get(pass).create(cc, context).process(null, root);
        }

        if (!context.isNoPrint()) {
            String code = ParserHelper.toSource(cc, root, context.isMinifyWhitespace());
            out.print(code);
            if (!code.endsWith("\n")) {
                out.println();
            }
            if (!context.getSuffix().isEmpty()) {
                out.println(context.getSuffix());
            }
        }
        out.flush();
    }

    /**
     * @return everything run would have printed
     */
    public static String optimize(String input, String... passes) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        run("input.js", input, ImmutableList.copyOf(passes), out);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    public static void main(String... args) {
        if (args.length < 1) {
            LOG.error("usage: GlueOptimizer <infile> [pass...]");
            System.exit(1);
        }

        try {
            String input = new String(Files.readAllBytes(Paths.get(args[0])), StandardCharsets.UTF_8);
            run(args[0], input, Arrays.asList(args).subList(1, args.length), System.out);
        } catch (IOException e) {
            LOG.error("failed to read {}", args[0], e);
            System.exit(1);
        } catch (RuntimeException e) {
            LOG.error(e.getMessage());
            System.exit(1);
        }
    }
}
