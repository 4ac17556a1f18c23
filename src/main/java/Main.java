import datagenerators.AdversarialGenerators;
import datagenerators.RandomSequences;
import suffixtree.DotExporter;
import suffixtree.Locus;
import suffixtree.Match;
import suffixtree.Occurrences;
import suffixtree.SuffixTree;
import suffixtree.SuffixTreeConfiguration;
import suffixtree.TreeStats;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Command line driver: builds a suffix tree over a text given inline or read from a file and
 * runs one query against it. {@code bench} builds over generated data instead and reports
 * timing and memory.
 *
 * <pre>
 *   --text abcabxabcd --command find --pattern ab
 *   --file book.txt --command lrs --ignore-case
 *   --command bench --generator fibonacci --length 1000000
 * </pre>
 */
public final class Main {

    private static final String DEFAULT_COMMAND = "stats";
    private static final String DEFAULT_GENERATOR = "uniform";
    private static final int DEFAULT_LENGTH = 1 << 20;
    private static final long DEFAULT_SEED = 42L;
    private static final int DEFAULT_SIGMA = 4;
    private static final int DEFAULT_LIMIT = 20;

    public static void main(String[] args) throws IOException {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            SuffixTreeLogger.error(e.getMessage());
            System.err.println(usage());
            System.exit(2);
            return;
        }
        run(options, System.out);
    }

    static void run(CliOptions options, PrintStream out) throws IOException {
        SuffixTreeConfiguration configuration = SuffixTreeConfiguration.builder()
                .caseSensitive(!options.ignoreCase)
                .verify(options.verify)
                .build();

        if (options.command.equals("bench")) {
            bench(options, configuration, out);
            return;
        }

        String text = options.loadText();
        SuffixTreeLogger.info(String.format(Locale.ROOT, "Indexing %d characters (command=%s)", text.length(), options.command));
        SuffixTree tree = SuffixTree.of(text, configuration);

        switch (options.command) {
            case "contains" -> out.println(tree.contains(options.requirePattern()));
            case "find" -> {
                Occurrences occurrences = tree.occurrences(options.requirePattern());
                int[] offsets = occurrences.toSortedArray();
                out.printf(Locale.ROOT, "%d occurrence(s)%n", offsets.length);
                for (int i = 0; i < offsets.length && i < options.limit; i++) {
                    out.println(offsets[i]);
                }
                if (offsets.length > options.limit) {
                    out.printf(Locale.ROOT, "... %d more%n", offsets.length - options.limit);
                }
            }
            case "lrs" -> {
                Match match = tree.longestRepeatedSubstring();
                if (match.isEmpty()) {
                    out.println("no repeated substring");
                } else {
                    out.printf(Locale.ROOT, "start=%d length=%d%n", match.start(), match.length());
                    out.println(tree.longestRepeatedSubstringText());
                }
            }
            case "stats" -> printStats(tree.stats(), out);
            case "dot" -> {
                DotExporter exporter = new DotExporter().withSuffixLinks(!options.noLinks);
                if (options.pattern != null) {
                    Locus locus = tree.locate(options.pattern);
                    if (locus != null) {
                        exporter.highlight(locus.subtreeRoot());
                    }
                }
                exporter.render(tree, out);
            }
            default -> throw new IllegalArgumentException("Unknown command " + options.command);
        }
    }

    private static void bench(CliOptions options, SuffixTreeConfiguration configuration, PrintStream out) {
        int[] symbols = generate(options);
        out.printf(Locale.ROOT, "Generator: %s  Length: %d  Seed: %d%n", options.generator, symbols.length, options.seed);

        long start = System.nanoTime();
        SuffixTree tree = SuffixTree.build(symbols, configuration);
        double elapsedMs = (System.nanoTime() - start) / 1e6;

        out.printf(Locale.ROOT, "Build: %.3f ms (%.1f ns/symbol)%n",
                elapsedMs, symbols.length == 0 ? 0.0 : elapsedMs * 1e6 / symbols.length);
        printStats(tree.stats(), out);

        Match lrs = tree.longestRepeatedSubstring();
        out.printf(Locale.ROOT, "Longest repeat: start=%d length=%d%n", lrs.start(), lrs.length());

        MemoryUsageReport report = tree.memoryReport(options.footprint);
        SuffixTreeLogger.info(String.format(Locale.ROOT, "Suffix tree memory: %.3f MiB (%.1f B/symbol)",
                report.totalMiB(), report.bytesPerSymbol()));
        out.println(report.report());
    }

    static int[] generate(CliOptions options) {
        int n = options.length;
        return switch (options.generator) {
            case "uniform" -> chars(RandomSequences.uniform(n, RandomSequences.DNA, options.seed));
            case "symbols" -> RandomSequences.uniformSymbols(n, options.sigma, options.seed);
            case "zipf" -> RandomSequences.zipfSymbols(n, options.sigma, 1.0, options.seed);
            case "repeated" -> chars(AdversarialGenerators.repeated('a', n));
            case "increasing" -> chars(AdversarialGenerators.strictlyIncreasing(n, '\u0100'));
            case "palindrome" -> chars(AdversarialGenerators.palindrome(n, RandomSequences.DNA, options.seed));
            case "fibonacci" -> chars(AdversarialGenerators.fibonacciWord(n));
            case "blocks" -> chars(AdversarialGenerators.alternatingBlocks(n, 64, RandomSequences.DNA));
            case "debruijn" -> chars(AdversarialGenerators.deBruijn(RandomSequences.DNA, 8, n));
            default -> throw new IllegalArgumentException("Unknown generator " + options.generator);
        };
    }

    private static int[] chars(String s) {
        int[] out = new int[s.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = s.charAt(i);
        }
        return out;
    }

    private static void printStats(TreeStats stats, PrintStream out) {
        out.printf(Locale.ROOT, "Text length: %d%n", stats.textLength());
        out.printf(Locale.ROOT, "Nodes: %d (internal %d, leaves %d)%n",
                stats.nodes(), stats.internalNodes(), stats.leaves());
        out.printf(Locale.ROOT, "Deepest internal node: %d%n", stats.maxInternalDepth());
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: Main (--text <s> | --file <path>) [--command contains|find|lrs|stats|dot] [--pattern <p>]",
                "            [--ignore-case] [--verify] [--limit <n>] [--no-links]",
                "       Main --command bench [--generator uniform|symbols|zipf|repeated|increasing|palindrome|",
                "            fibonacci|blocks|debruijn] [--length <n>] [--seed <n>] [--sigma <n>] [--footprint]");
    }

    static final class CliOptions {
        final String command;
        final String text;
        final Path file;
        final String pattern;
        final boolean ignoreCase;
        final boolean verify;
        final boolean noLinks;
        final boolean footprint;
        final int limit;
        final String generator;
        final int length;
        final long seed;
        final int sigma;

        private CliOptions(String command,
                           String text,
                           Path file,
                           String pattern,
                           boolean ignoreCase,
                           boolean verify,
                           boolean noLinks,
                           boolean footprint,
                           int limit,
                           String generator,
                           int length,
                           long seed,
                           int sigma) {
            this.command = command;
            this.text = text;
            this.file = file;
            this.pattern = pattern;
            this.ignoreCase = ignoreCase;
            this.verify = verify;
            this.noLinks = noLinks;
            this.footprint = footprint;
            this.limit = limit;
            this.generator = generator;
            this.length = length;
            this.seed = seed;
            this.sigma = sigma;
        }

        static CliOptions parse(String[] args) {
            String command = DEFAULT_COMMAND;
            String text = null;
            Path file = null;
            String pattern = null;
            boolean ignoreCase = false;
            boolean verify = false;
            boolean noLinks = false;
            boolean footprint = false;
            int limit = DEFAULT_LIMIT;
            String generator = DEFAULT_GENERATOR;
            int length = DEFAULT_LENGTH;
            long seed = DEFAULT_SEED;
            int sigma = DEFAULT_SIGMA;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                }

                // switches take no value
                switch (key) {
                    case "ignore-case" -> { ignoreCase = true; continue; }
                    case "verify" -> { verify = true; continue; }
                    case "no-links" -> { noLinks = true; continue; }
                    case "footprint" -> { footprint = true; continue; }
                    default -> { }
                }

                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "command" -> command = value.toLowerCase(Locale.ROOT);
                    case "text" -> text = value;
                    case "file" -> file = Path.of(value);
                    case "pattern" -> pattern = value;
                    case "limit" -> limit = parsePositive(key, value);
                    case "generator" -> generator = value.toLowerCase(Locale.ROOT);
                    case "length" -> length = parsePositive(key, value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "sigma" -> sigma = parsePositive(key, value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            switch (command) {
                case "contains", "find", "lrs", "stats", "dot" -> {
                    if (text == null && file == null) {
                        throw new IllegalArgumentException("--text or --file is required for command " + command);
                    }
                    if (text != null && file != null) {
                        throw new IllegalArgumentException("--text and --file are mutually exclusive");
                    }
                }
                case "bench" -> { }
                default -> throw new IllegalArgumentException("Unknown command " + command);
            }

            return new CliOptions(command, text, file, pattern, ignoreCase, verify, noLinks, footprint,
                    limit, generator, length, seed, sigma);
        }

        private static int parsePositive(String key, String value) {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--" + key + " expects an integer, got " + value, e);
            }
            if (parsed <= 0) {
                throw new IllegalArgumentException("--" + key + " must be positive");
            }
            return parsed;
        }

        String requirePattern() {
            if (pattern == null) {
                throw new IllegalArgumentException("--pattern is required for command " + command);
            }
            return pattern;
        }

        String loadText() throws IOException {
            if (text != null) {
                return text;
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        }
    }
}
