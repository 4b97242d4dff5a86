package org.neuralchilli.tickflow.monitoring;

import javax.annotation.Nonnull;

/**
 * Link of the receipt chain: the hash of the marking after a tick, chained
 * to the receipt before it.
 *
 * @param stateHash    SHA-256 of the marking after the tick
 * @param previousHash receipt hash of the previous tick, empty for the first
 * @param hash         SHA-256 over tick number, state hash and previous hash
 */
public record Receipt(long tickNumber, String stateHash, String previousHash, String hash) {

    @Nonnull
    @Override
    public String toString() {
        return "Receipt{tick=" + tickNumber + ", hash=" + hash.substring(0, Math.min(12, hash.length())) + "}";
    }
}
