package com.bag;

import java.util.ArrayList;
import java.util.List;

public class Main {

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Applies the arguments to a fresh bag and prints the result.
     *
     * @return the process exit status, 0 on success
     */
    static int run(String[] args) {
        if (args.length == 0) {
            runDemo();
            System.out.println("\n--- Usage ---");
            printUsage();
            return 0;
        }

        // Format: <value|-index> ... where -N removes the N-th insertion (1-based)
        Bag<String> bag = new Bag<>();
        List<Bag.Token> issued = new ArrayList<>();

        for (String arg : args) {
            if (arg.startsWith("-") && arg.length() > 1) {
                int insertion;
                try {
                    insertion = Integer.parseInt(arg.substring(1));
                } catch (NumberFormatException e) {
                    System.err.println("Error: Invalid removal '" + arg + "'");
                    printUsage();
                    return 1;
                }
                if (insertion < 1 || insertion > issued.size()) {
                    System.err.println("Error: No insertion #" + insertion + " (have " + issued.size() + ")");
                    return 1;
                }
                bag.remove(issued.get(insertion - 1));
            } else {
                issued.add(bag.insert(arg));
            }
        }

        System.out.println(bag);
        return 0;
    }

    private static void runDemo() {
        System.out.println("=== Token Bag Demo ===\n");

        Bag<String> bag = new Bag<>();

        Bag.Token a = bag.insert("a");
        Bag.Token b = bag.insert("b");
        Bag.Token c = bag.insert("c");
        System.out.printf("insert a -> %s, b -> %s, c -> %s%n", a, b, c);
        System.out.println("Contents: " + bag);

        bag.remove(b);
        System.out.println("\nremove " + b);
        System.out.println("Contents: " + bag);

        bag.remove(b);
        System.out.println("\nremove " + b + " again (no-op)");
        System.out.println("Contents: " + bag);

        Bag.Token d = bag.insert("d");
        System.out.println("\ninsert d -> " + d);
        System.out.println("Contents: " + bag);

        System.out.println("\n--- Duplicate Values ---\n");

        Bag<String> dup = new Bag<>();
        Bag.Token first = dup.insert("x");
        Bag.Token second = dup.insert("x");
        System.out.printf("insert x -> %s, insert x -> %s%n", first, second);
        dup.remove(first);
        System.out.println("remove " + first + " -> " + dup + " (only that insertion is gone)");

        System.out.println("\n--- Indexed Access ---\n");
        for (int i = bag.startIndex(); i < bag.endIndex(); i++) {
            System.out.printf("  [%d] %s%n", i, bag.get(i));
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar token-bag.jar <value|-N> [<value|-N> ...]");
        System.out.println();
        System.out.println("A value inserts it; -N removes the N-th insertion (1-based).");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar token-bag.jar a b c -2        prints [a, c]");
        System.out.println("  java -jar token-bag.jar a b c -2 -2 d   prints [a, c, d]");
        System.out.println();
        System.out.println("Run without arguments to see demo.");
    }
}
