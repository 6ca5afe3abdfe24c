package org.patternlab.behavioral.observer;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Observer recording every delivered temperature in delivery order.
 *
 * <p>Readings live in a primitive list; {@link #readings()} returns a defensive copy. A subject
 * that has not published a temperature yet broadcasts {@code null}; such deliveries are skipped
 * and not counted.</p>
 */
public final class TemperatureHistory implements Observer<Integer> {
    private final IntArrayList readings = new IntArrayList();

    @Override
    public void onValueChanged(Integer temperature) {
        if (temperature == null) {
            return;
        }
        readings.add(temperature.intValue());
    }

    /**
     * Returns a copy of all recorded readings, oldest first.
     */
    public int[] readings() {
        return readings.toIntArray();
    }

    public int size() {
        return readings.size();
    }

    /**
     * Returns the most recent reading.
     *
     * @throws IllegalStateException when nothing has been recorded yet.
     */
    public int latest() {
        if (readings.isEmpty()) {
            throw new IllegalStateException("no readings recorded");
        }
        return readings.getInt(readings.size() - 1);
    }

    /**
     * Returns arithmetic mean of recorded readings, or NaN when empty.
     */
    public double average() {
        if (readings.isEmpty()) {
            return Double.NaN;
        }
        long sum = 0L;
        for (int i = 0; i < readings.size(); i++) {
            sum += readings.getInt(i);
        }
        return (double) sum / readings.size();
    }

    public void clear() {
        readings.clear();
    }
}
