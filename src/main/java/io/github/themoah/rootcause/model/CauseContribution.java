package io.github.themoah.rootcause.model;

/**
 * One (event, episode) pairing that fell inside the correlation window.
 *
 * @param event the candidate cause
 * @param episode the abnormal window it was paired with
 * @param distanceSeconds distance from the event to the episode, 0 when inside it
 * @param rawScore proximity * prior * severity
 * @param evidence human readable description of the pairing
 */
public record CauseContribution(
  Event event,
  Episode episode,
  double distanceSeconds,
  double rawScore,
  String evidence
) {}
