package com.example.mythic.settlement;

/**
 * Outcome of one best-effort settlement side effect (reputation or memory write).
 * Failures are reported here instead of being thrown.
 */
public final class SideEffectResult {

    private final String name;
    private final boolean ok;
    private final String reason;

    private SideEffectResult(String name, boolean ok, String reason) {
        this.name = name;
        this.ok = ok;
        this.reason = reason;
    }

    public static SideEffectResult ok(String name) {
        return new SideEffectResult(name, true, null);
    }

    public static SideEffectResult failed(String name, String reason) {
        return new SideEffectResult(name, false, reason);
    }

    public String getName() { return name; }
    public boolean isOk() { return ok; }

    /** Null when ok */
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return ok ? name + ": ok" : name + ": failed (" + reason + ")";
    }
}
