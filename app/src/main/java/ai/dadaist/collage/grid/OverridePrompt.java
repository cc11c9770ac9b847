package ai.dadaist.collage.grid;

/**
 * Decides whether an allocation above the configured memory ceiling may proceed.
 * Interactive callers can ask the user; batch callers pick {@link #DENY} or {@link #ALLOW}.
 */
@FunctionalInterface
public interface OverridePrompt {

    OverridePrompt DENY = (requiredBytes, ceilingBytes, spec) -> false;
    OverridePrompt ALLOW = (requiredBytes, ceilingBytes, spec) -> true;

    boolean confirm(long requiredBytes, long ceilingBytes, GridSpec spec);
}
