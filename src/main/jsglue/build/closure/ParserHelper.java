package jsglue.build.closure;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.JsAst;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class ParserHelper {

    // keep in sync with what the toolchain emits
    public static final CompilerOptions.LanguageMode LANGUAGE_IN = CompilerOptions.LanguageMode.ECMASCRIPT_2020;

    public static Compiler createCompiler() {
        Compiler cc = new Compiler();

        CompilerOptions co = new CompilerOptions();
        co.setLanguageIn(LANGUAGE_IN);
        co.setPrettyPrint(true);
        // directives are turned into statements by parse, the printer must not add another one
        co.setEmitUseStrict(false);
        cc.initOptions(co);

        return cc;
    }

    /**
     * parses into a SCRIPT node, fails with the offending line on the first error
     */
    public static Node parse(Compiler cc, String name, String code) {
        SourceFile srcFile = SourceFile.fromCode(name, code);

        JsAst ast = new JsAst(srcFile);
        Node node = ast.getAstRoot(cc);

        for (JSError error : cc.getErrors()) {
            throw new JsParseException(error.getDescription(), code, error.getLineno(), error.getCharno());
        }

        restoreDirectives(node);
        return node;
    }

    /**
     * The parser moves 'use strict' out of the script and function bodies into a node property,
     * which the printer only emits for the script and only when configured to. Puts them back as
     * the expression statements they were so passes see them and printing keeps them.
     */
    static void restoreDirectives(Node root) {
        TreeWalk.full(root, node -> {
            Set<String> directives = node.getDirectives();
            if (directives == null || directives.isEmpty()) {
                return;
            }
            List<String> sorted = new ArrayList<>(directives);
            Collections.sort(sorted, Collections.reverseOrder());
            for (String directive : sorted) {
                node.addChildToFront(IR.exprResult(IR.string(directive)));
            }
            node.setDirectives(null);
        });
    }

    public static String toSource(Compiler cc, Node node, boolean minifyWhitespace) {
        cc.getOptions().setPrettyPrint(!minifyWhitespace);
        return cc.toSource(node);
    }
}
