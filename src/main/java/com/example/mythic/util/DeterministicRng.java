package com.example.mythic.util;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Seeded, label-keyed pseudo-random source.
 *
 * Every value is a pure function of {@code (seed, label)}: the first 16 hex digits of
 * MD5({@code seed + ":" + label}) are read as an unsigned 64-bit number and reduced modulo
 * 1e9 into [0, 1). Distinct labels give independent-looking streams for the same seed, so
 * call sites build labels from stable parts (session, turn, actor, target, purpose).
 */
public class DeterministicRng {

    private static final BigInteger MODULUS = BigInteger.valueOf(1_000_000_000L);

    /**
     * Uniform value in [0, 1).
     */
    public double next01(int seed, String label) {
        String input = seed + ":" + (label == null ? "" : label);
        String hex = md5Hex(input).substring(0, 16);
        BigInteger n = new BigInteger(hex, 16);
        return n.mod(MODULUS).longValue() / 1_000_000_000.0;
    }

    /**
     * Uniform integer in [min, max], inclusive. Swapped bounds are tolerated.
     */
    public int nextInt(int seed, String label, int min, int max) {
        int lo = Math.min(min, max);
        int hi = Math.max(min, max);
        long span = (long) hi - lo + 1;
        if (span <= 1) return lo;
        return (int) (lo + (long) Math.floor(next01(seed, label) * span));
    }

    /**
     * Pick one candidate uniformly.
     * @throws IllegalArgumentException if there are no candidates
     */
    public <T> T pick(int seed, String label, List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty candidate list (label=" + label + ")");
        }
        return candidates.get(nextInt(seed, label, 0, candidates.size() - 1));
    }

    /**
     * Pick one item with probability proportional to its weight. Negative weights count as zero;
     * if every weight is zero the first item is returned.
     */
    public <T> T weightedPick(int seed, String label, List<T> items, List<Integer> weights) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty candidate list (label=" + label + ")");
        }
        if (weights == null || weights.size() != items.size()) {
            throw new IllegalArgumentException("Weights must match candidates");
        }
        long total = 0;
        for (int w : weights) {
            total += Math.max(0, w);
        }
        if (total <= 0) return items.get(0);
        double r = next01(seed, label) * total;
        long acc = 0;
        for (int i = 0; i < items.size(); i++) {
            acc += Math.max(0, weights.get(i));
            if (r <= acc) return items.get(i);
        }
        return items.get(items.size() - 1);
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
