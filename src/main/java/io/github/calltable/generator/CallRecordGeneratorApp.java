package io.github.calltable.generator;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point for writing a synthetic input file.
 *
 * <pre>
 * CallRecordGeneratorApp &lt;output_file&gt; [--count N] [--seed S]
 * </pre>
 */
public class CallRecordGeneratorApp {

    static final int DEFAULT_COUNT = 100;
    static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) {
        try {
            Options options = Options.parse(args);
            new CallRecordGenerator(options.seed).write(options.target, options.count);
            System.out.println("Saved " + options.count + " records to " + options.target);
        } catch (IllegalArgumentException e) {
            System.err.println("usage: generate-calls <output_file> [--count N] [--seed S]");
            System.err.println("generate-calls: error: " + e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            System.err.println("generate-calls: error: " + e.getMessage());
            System.exit(1);
        }
    }

    static final class Options {
        final Path target;
        final int count;
        final long seed;

        private Options(Path target, int count, long seed) {
            this.target = target;
            this.count = count;
            this.seed = seed;
        }

        static Options parse(String[] args) {
            Path target = null;
            int count = DEFAULT_COUNT;
            long seed = DEFAULT_SEED;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--count" -> count = Integer.parseInt(valueAfter(args, ++i, arg));
                    case "--seed" -> seed = Long.parseLong(valueAfter(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-") || target != null) {
                            throw new IllegalArgumentException("unrecognized arguments: " + arg);
                        }
                        target = Paths.get(arg);
                    }
                }
            }
            if (target == null) {
                throw new IllegalArgumentException("the following arguments are required: output_file");
            }
            if (count < 0) {
                throw new IllegalArgumentException("--count must not be negative: " + count);
            }
            return new Options(target, count, seed);
        }

        private static String valueAfter(String[] args, int index, String name) {
            if (index >= args.length) {
                throw new IllegalArgumentException("argument " + name + ": expected one argument");
            }
            return args[index];
        }
    }
}
