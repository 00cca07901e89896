package net.littleredcomputer.prover.logic;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A logic variable. Variables compare by identity: two variables with the same name are
 * different variables unless they are the same object. Variables introduced by the prover
 * are named after their serial number.
 */
public final class Variable extends Term {
    private static final AtomicLong serial = new AtomicLong();
    private final String name;

    public Variable(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("variable must be named");
        this.name = name;
    }

    public static Variable fresh() {
        return new Variable("_G" + serial.incrementAndGet());
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
