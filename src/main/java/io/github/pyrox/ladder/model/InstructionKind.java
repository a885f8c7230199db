package io.github.pyrox.ladder.model;

import java.util.Locale;
import java.util.Set;

/**
 * Visual category of an instruction: input condition, output condition or function block.
 */
public enum InstructionKind {
    CONTACT,
    COIL,
    BLOCK;

    private static final Set<String> CONTACTS = Set.of("XIC", "XIO");
    private static final Set<String> COILS = Set.of("OTE", "OTL", "OTU");

    public static InstructionKind of(String mnemonic) {
        var upper = mnemonic.toUpperCase(Locale.ROOT);
        if (CONTACTS.contains(upper)) {
            return CONTACT;
        }
        if (COILS.contains(upper)) {
            return COIL;
        }
        return BLOCK;
    }
}
