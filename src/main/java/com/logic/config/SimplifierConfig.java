package com.logic.config;

import com.logic.parser.TokenizerMode;
import com.logic.simplifier.FixedPointSimplifier;
import com.logic.simplifier.NonConvergencePolicy;

/**
 * Root configuration for the logic simplifier.
 *
 * @param name                 Configuration name, used in logs
 * @param maxIterations        Cap on fixed-point simplification passes
 * @param tokenizerMode        How expression text is tokenized
 * @param nonConvergencePolicy What to do when the iteration cap is hit
 */
public record SimplifierConfig(
        String name,
        int maxIterations,
        TokenizerMode tokenizerMode,
        NonConvergencePolicy nonConvergencePolicy
) {
    /**
     * Default configuration: LEGACY tokenizer, 10 iterations, warn on non-convergence.
     */
    public static SimplifierConfig defaults() {
        return new SimplifierConfig(
                "default",
                FixedPointSimplifier.DEFAULT_MAX_ITERATIONS,
                TokenizerMode.LEGACY,
                NonConvergencePolicy.WARN
        );
    }

    public SimplifierConfig withTokenizerMode(TokenizerMode mode) {
        return new SimplifierConfig(name, maxIterations, mode, nonConvergencePolicy);
    }

    public SimplifierConfig withMaxIterations(int iterations) {
        return new SimplifierConfig(name, iterations, tokenizerMode, nonConvergencePolicy);
    }

    public SimplifierConfig withNonConvergencePolicy(NonConvergencePolicy policy) {
        return new SimplifierConfig(name, maxIterations, tokenizerMode, policy);
    }
}
