package com.questrail.helix.constraints;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SequenceConstraintAnalyzer
 * -----------------------------------------------------------------------------
 * Measures encoded sequences against a {@link ConstraintPolicy}.
 *
 * <p>Two properties are measured:</p>
 * <ul>
 *   <li>GC content: fraction of {@code G} and {@code C} across the sequence</li>
 *   <li>Homopolymer runs: maximal stretches of a single repeated symbol</li>
 * </ul>
 *
 * <p>Analysis is read-only and case-insensitive.</p>
 */
public final class SequenceConstraintAnalyzer
{
    private final ConstraintPolicy policy;

    public SequenceConstraintAnalyzer(ConstraintPolicy policy)
    {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ConstraintReport analyze(int sequenceIndex, CharSequence sequence)
    {
        Objects.requireNonNull(sequence, "sequence");

        final List<ConstraintViolation> violations = new ArrayList<>();
        final int length = sequence.length();

        int gc = 0;
        int longest = 0;
        int runStart = 0;

        for (int i = 0; i <= length; i++) {
            final boolean runEnds = i == length
                    || (i > 0 && upper(sequence.charAt(i)) != upper(sequence.charAt(i - 1)));

            if (runEnds && i > 0) {
                final int run = i - runStart;
                longest = Math.max(longest, run);
                if (run > policy.maxHomopolymerRun()) {
                    violations.add(new ConstraintViolation.Homopolymer(
                            runStart, upper(sequence.charAt(runStart)), run, policy.maxHomopolymerRun()));
                }
                runStart = i;
            }

            if (i < length) {
                final char c = upper(sequence.charAt(i));
                if (c == 'G' || c == 'C') {
                    gc++;
                }
            }
        }

        final double gcContent = length == 0 ? 0.0 : (double) gc / length;
        if (length > 0 && (gcContent < policy.minGcContent() || gcContent > policy.maxGcContent())) {
            violations.add(0, new ConstraintViolation.GcContent(
                    gcContent, policy.minGcContent(), policy.maxGcContent()));
        }

        return new ConstraintReport(sequenceIndex, gcContent, longest, violations);
    }

    public List<ConstraintReport> analyzeAll(List<String> sequences)
    {
        Objects.requireNonNull(sequences, "sequences");
        final List<ConstraintReport> reports = new ArrayList<>(sequences.size());
        for (int i = 0; i < sequences.size(); i++) {
            reports.add(analyze(i, sequences.get(i)));
        }
        return reports;
    }

    public ConstraintPolicy policy()
    {
        return policy;
    }

    private static char upper(char c)
    {
        return Character.toUpperCase(c);
    }
}
