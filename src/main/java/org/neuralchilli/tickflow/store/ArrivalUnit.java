package org.neuralchilli.tickflow.store;

/**
 * One unit of work waiting in front of a gated node.
 *
 * @param predecessor node the unit came from
 * @param instance    thread or instance id, null for singletons
 * @param holder      fact to remove when the unit is consumed: a parked
 *                    {@link ArrivalFact}, or the token a plain predecessor
 *                    still holds after completing
 */
public record ArrivalUnit(String predecessor, Integer instance, Fact holder) {
}
