package com.questrail.scenario.api;

/**
 * Verdict
 * -----------------------------------------------------------------------------
 * {@code Verdict} is the tri-state outcome of a scenario, recomputed once per
 * simulation tick from the success and failure criteria.
 *
 * <h2>Terminal States</h2>
 * {@link #SUCCEEDED} and {@link #FAILED} are terminal. Once a scenario has
 * reached one of them, neither criteria tree is evaluated again; ticking a
 * terminated scenario is a caller error.
 *
 * <h2>Precedence</h2>
 * When both trees hold in the same tick the failure wins:
 * <ul>
 *   <li>failure tree true → {@link #FAILED}</li>
 *   <li>otherwise success tree true → {@link #SUCCEEDED}</li>
 *   <li>otherwise → {@link #RUNNING}</li>
 * </ul>
 */
public enum Verdict
{
    /**
     * Neither criteria tree holds yet; the scenario keeps running.
     */
    RUNNING,

    /**
     * The success criteria held (and the failure criteria did not).
     */
    SUCCEEDED,

    /**
     * The failure criteria held.
     */
    FAILED;

    /**
     * @return {@code true} if no further ticks may be evaluated
     */
    public boolean isTerminal()
    {
        return this != RUNNING;
    }

    /**
     * Reduces one tick's criteria results into a verdict.
     *
     * @param success result of the success tree this tick
     * @param failure result of the failure tree this tick
     * @return the verdict for this tick
     */
    public static Verdict reduce(boolean success, boolean failure)
    {
        if (failure) {
            return FAILED;
        }
        return success ? SUCCEEDED : RUNNING;
    }
}
