package org.fm.analysis;

import java.time.Duration;

/**
 * Limiti del ciclo di enumerazione: numero massimo di soluzioni e tempo massimo.
 * Un limite raggiunto interrompe il ciclo e marca il risultato come troncato.
 */
public final class EnumerationLimits {

    public static final int DEFAULT_MAX_SOLUTIONS = 10_000;

    private final int maxSolutions;
    private final Duration timeout;

    private EnumerationLimits(int maxSolutions, Duration timeout) {
        if (maxSolutions <= 0) {
            throw new IllegalArgumentException("Numero massimo di soluzioni deve essere > 0: " + maxSolutions);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout deve essere positivo: " + timeout);
        }
        this.maxSolutions = maxSolutions;
        this.timeout = timeout;
    }

    /**
     * @param timeout null per nessun limite di tempo
     */
    public static EnumerationLimits of(int maxSolutions, Duration timeout) {
        return new EnumerationLimits(maxSolutions, timeout);
    }

    /**
     * @return {@value #DEFAULT_MAX_SOLUTIONS} soluzioni, nessun limite di tempo
     */
    public static EnumerationLimits defaults() {
        return new EnumerationLimits(DEFAULT_MAX_SOLUTIONS, null);
    }

    public static EnumerationLimits unbounded() {
        return new EnumerationLimits(Integer.MAX_VALUE, null);
    }

    public int getMaxSolutions() {
        return maxSolutions;
    }

    /**
     * @return limite di tempo, null se assente
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasTimeout() {
        return timeout != null;
    }

    @Override
    public String toString() {
        return "EnumerationLimits{max=" + maxSolutions + ", timeout=" + (timeout == null ? "nessuno" : timeout) + "}";
    }
}
