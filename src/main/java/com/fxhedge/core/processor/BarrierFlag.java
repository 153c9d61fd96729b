package com.fxhedge.core.processor;

import com.fxhedge.domain.enums.OptionKind;

/**
 * The eight standard single-barrier contracts: call/put x down/up x in/out.
 * "Down" barriers sit below spot and are hit by a falling rate, "up" barriers above.
 */
public enum BarrierFlag {
    CDI(OptionKind.CALL, true, true),
    CUI(OptionKind.CALL, false, true),
    PDI(OptionKind.PUT, true, true),
    PUI(OptionKind.PUT, false, true),
    CDO(OptionKind.CALL, true, false),
    CUO(OptionKind.CALL, false, false),
    PDO(OptionKind.PUT, true, false),
    PUO(OptionKind.PUT, false, false);

    private final OptionKind kind;
    private final boolean down;
    private final boolean knockIn;

    BarrierFlag(OptionKind kind, boolean down, boolean knockIn) {
        this.kind = kind;
        this.down = down;
        this.knockIn = knockIn;
    }

    public OptionKind kind() {
        return kind;
    }

    public boolean isDown() {
        return down;
    }

    public boolean isKnockIn() {
        return knockIn;
    }

    public static BarrierFlag of(OptionKind kind, boolean down, boolean knockIn) {
        for (BarrierFlag flag : values()) {
            if (flag.kind == kind && flag.down == down && flag.knockIn == knockIn) {
                return flag;
            }
        }
        throw new IllegalArgumentException("No barrier flag for " + kind + ", down=" + down + ", in=" + knockIn);
    }
}
