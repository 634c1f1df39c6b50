package com.testconductor.interrupt;

/**
 * Decides what a popup is asking for. Swappable so that the text heuristics can
 * be replaced without touching the interrupt protocol or the scheduler.
 *
 * Implementations may throw; the {@link PopupInterruptHandler} treats any
 * exception as an unreadable popup and rejects it.
 */
public interface PopupClassifier {
    PopupClassification classify(PopupContent content);
}
