package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.League;

import java.util.Locale;

/**
 * Soft costs used to rank schedules that are already optimal on the hard score. Metrics
 * named {@code unfair...} measure spread across teams as a population standard deviation.
 */
public enum PainMetric {

    DOUBLE_HEADER_PAIN("doubleHeaderPain", 0.05) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.sum(metrics.perTeam(WeekMetrics::doubleHeaders));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::doubleHeaders));
        }
    },
    UNFAIR_DOUBLE_HEADER_PAIN("unfairDoubleHeaderPain", 0.5) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(metrics.perTeam(WeekMetrics::doubleHeaders));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::doubleHeaders));
        }
    },
    DOUBLE_BYE_PAIN("doubleByePain", 0.0) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.sum(metrics.perTeam(WeekMetrics::doubleByes));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::doubleByes));
        }
    },
    UNFAIR_DOUBLE_BYE_PAIN("unfairDoubleByePain", 0.5) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(metrics.perTeam(WeekMetrics::doubleByes));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::doubleByes));
        }
    },
    TOTAL_SLOTS_PAIN("totalSlotsPain", 0.01) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.sum(metrics.perTeam(WeekMetrics::spans));
        }

        @Override
        public String details(PathMetrics metrics) {
            return (int) raw(metrics) + " slots spanned";
        }
    },
    UNFAIR_SLOTS_PAIN("unfairSlotsPain", 0.1) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(metrics.perTeam(WeekMetrics::spans));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::spans));
        }
    },
    UNFAIR_PAIN_PER_TEAM("unfairPainPerTeam", 0.0) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(combinedPain(metrics));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(combinedPain(metrics));
        }
    },
    UNFAIR_EARLY_LATE("unfairEarlyLate", 0.4) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(metrics.perTeam(WeekMetrics::early))
                + PathMetrics.stddev(metrics.perTeam(WeekMetrics::late));
        }

        @Override
        public String details(PathMetrics metrics) {
            int[] early = metrics.perTeam(WeekMetrics::early);
            int[] late = metrics.perTeam(WeekMetrics::late);
            StringBuilder sb = new StringBuilder();
            for (int t = 0; t < early.length; t++) {
                if (t > 0) {
                    sb.append(' ');
                }
                sb.append(League.teamLetter(t)).append(":[").append(early[t]).append(',').append(late[t]).append(']');
            }
            return sb.toString();
        }
    },
    UNFAIR_3RD_VS_2ND("unfair3rdVs2nd", 0.5) {
        @Override
        public double raw(PathMetrics metrics) {
            return PathMetrics.stddev(metrics.perTeam(WeekMetrics::thirdVsSecond));
        }

        @Override
        public String details(PathMetrics metrics) {
            return PathMetrics.byTeam(metrics.perTeam(WeekMetrics::thirdVsSecond));
        }
    },
    UNEVEN_MATCHUPS("unevenMatchups", 1.0) {
        @Override
        public double raw(PathMetrics metrics) {
            int[][] counts = metrics.opponentCounts();
            for (int t = 0; t < counts.length; t++) {
                if (opponentSpread(counts, t) > 1) {
                    return UNEVEN_PENALTY;
                }
            }
            return 0;
        }

        @Override
        public String details(PathMetrics metrics) {
            int[][] counts = metrics.opponentCounts();
            StringBuilder sb = new StringBuilder();
            for (int t = 0; t < counts.length; t++) {
                if (opponentSpread(counts, t) > 1) {
                    if (sb.length() > 0) {
                        sb.append(' ');
                    }
                    sb.append(League.teamLetter(t)).append(':').append(opponentSpread(counts, t));
                }
            }
            return sb.length() == 0 ? "balanced" : "uneven " + sb;
        }
    };

    private static final double UNEVEN_PENALTY = 100;

    private final String key;
    private final double defaultWeight;

    PainMetric(String key, double defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    /** Name used in weight files and reports. */
    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    /** Unweighted value for one path. */
    public abstract double raw(PathMetrics metrics);

    /** Per-team breakdown for reports. */
    public abstract String details(PathMetrics metrics);

    /**
     * @throws IllegalArgumentException for an unknown key
     */
    public static PainMetric fromKey(String key) {
        for (PainMetric metric : values()) {
            if (metric.key.equals(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown pain metric: " + key);
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static int[] combinedPain(PathMetrics metrics) {
        int[] headers = metrics.perTeam(WeekMetrics::doubleHeaders);
        int[] byes = metrics.perTeam(WeekMetrics::doubleByes);
        int[] combined = new int[headers.length];
        for (int t = 0; t < combined.length; t++) {
            combined[t] = headers[t] + byes[t];
        }
        return combined;
    }

    // Largest minus smallest number of games against any one opponent.
    private static int opponentSpread(int[][] counts, int team) {
        int min = Integer.MAX_VALUE;
        int max = 0;
        for (int o = 0; o < counts.length; o++) {
            if (o != team) {
                min = Math.min(min, counts[team][o]);
                max = Math.max(max, counts[team][o]);
            }
        }
        return max - min;
    }
}
