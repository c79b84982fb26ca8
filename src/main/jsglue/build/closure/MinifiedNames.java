package jsglue.build.closure;

import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates short identifiers a, b, .., $, aa, ba, .. in a fixed order.
 * <p>
 * Names are generated on demand and remembered, so index n always maps to the same name no matter
 * which pass asked first. Never reset within a run.
 */
public class MinifiedNames {

    public static final String VALID_INITS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_$";
    public static final String VALID_LATERS = VALID_INITS + "0123456789";

    // only short words matter, longer ones are far beyond what any program allocates
    public static final ImmutableSet<String> RESERVED = ImmutableSet.of(
            "do", "if", "in",
            "for", "let", "new", "try", "var", "env",
            "case", "else", "enum", "eval", "null", "this", "true", "void", "with");

    private final List<String> names = new ArrayList<>();
    // one digit per character, first digit indexes VALID_INITS, the others VALID_LATERS
    private final List<Integer> state = new ArrayList<>();

    public MinifiedNames() {
        state.add(0);
    }

    public String get(int index) {
        checkIndex(index);
        while (names.size() <= index) {
            String name = current();
            if (!RESERVED.contains(name)) {
                names.add(name);
            }
            increment();
        }
        return names.get(index);
    }

    public int generated() {
        return names.size();
    }

    private static void checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative name index " + index);
        }
    }

    private String current() {
        StringBuilder sb = new StringBuilder(state.size());
        sb.append(VALID_INITS.charAt(state.get(0)));
        for (int i = 1; i < state.size(); i++) {
            sb.append(VALID_LATERS.charAt(state.get(i)));
        }
        return sb.toString();
    }

    private void increment() {
        int i = 0;
        while (true) {
            int digit = state.get(i) + 1;
            int base = (i == 0 ? VALID_INITS : VALID_LATERS).length();
            if (digit < base) {
                state.set(i, digit);
                return;
            }
            // overflow, carry into the next digit
            state.set(i, 0);
            i++;
            if (i == state.size()) {
                state.add(0);
                return;
            }
        }
    }
}
