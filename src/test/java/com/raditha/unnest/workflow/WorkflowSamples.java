package com.raditha.unnest.workflow;

/**
 * Units shared by the workflow tests.
 */
final class WorkflowSamples {

    static final String GUARDS = """
            class Calc {
                int f(int a, int b, int c) {
                    if (a > 0) {
                        if (b > 0) {
                            if (c > 0) {
                                return 1;
                            }
                            return 2;
                        }
                        return 3;
                    }
                    return 4;
                }
            }
            """;

    static final String GUARDS_RESULT = """
            class Calc {
                int f(int a, int b, int c) {
                    if (!(a > 0)) {
                        return 4;
                    }
                    if (!(b > 0)) {
                        return 3;
                    }
                    if (!(c > 0)) {
                        return 2;
                    }
                    return 1;
                }
            }
            """;

    static final String FLAT = """
            class Flat {
                int g(int a) {
                    if (a > 0) {
                        return 1;
                    }
                    return 0;
                }
            }
            """;

    /** a chain whose first branch holds a loop with a chain of its own */
    static final String OVERLAP = """
            class Overlap {
                void f(int a, int b, int[] xs) {
                    if (a > 0) {
                        if (b > 0) {
                            for (int x : xs) {
                                if (x > 0) {
                                    if (x > 1) {
                                        if (x > 2) {
                                            System.out.println(x);
                                        }
                                    }
                                }
                            }
                            if (a > b) {
                                System.out.println(a);
                            }
                        }
                    }
                }
            }
            """;

    static final String PYTHON = """
            def check(a, b, c):
                if a:
                    if b is not None:
                        if c in allowed:
                            return True
                return False
            """;

    private WorkflowSamples() {
    }
}
