package jsglue.build.closure;

import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * state shared by all passes of one run
 */
public class OptimizerContext {
    private static final Logger LOG = LoggerFactory.getLogger(OptimizerContext.class);

    private final ExtraInfo extraInfo;
    private final PrintStream out;
    private final MinifiedNames minifiedNames = new MinifiedNames();
    private final Set<String> warned = new LinkedHashSet<>();

    private boolean verbose = false;
    private boolean noPrint = false;
    private boolean minifyWhitespace = false;
    private String suffix = "";

    public OptimizerContext(ExtraInfo extraInfo, PrintStream out) {
        this.extraInfo = extraInfo;
        this.out = out;
    }

    public ExtraInfo getExtraInfo() {
        return extraInfo;
    }

    public ExtraInfo requireExtraInfo(String pass) {
        checkState(extraInfo != null, "%s needs the %s payload", pass, ExtraInfo.MARKER);
        return extraInfo;
    }

    /**
     * primary output, the graph goes here instead of the code
     */
    public PrintStream out() {
        return out;
    }

    public MinifiedNames getMinifiedNames() {
        return minifiedNames;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isNoPrint() {
        return noPrint;
    }

    public void setNoPrint(boolean noPrint) {
        this.noPrint = noPrint;
    }

    public boolean isMinifyWhitespace() {
        return minifyWhitespace;
    }

    public void setMinifyWhitespace(boolean minifyWhitespace) {
        this.minifyWhitespace = minifyWhitespace;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public void warnOnce(String msg) {
        if (warned.add(msg)) {
            LOG.warn(msg);
        }
    }

    public ImmutableSet<String> getWarnings() {
        return ImmutableSet.copyOf(warned);
    }
}
