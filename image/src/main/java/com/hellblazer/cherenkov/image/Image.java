/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cherenkov.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cherenkov.image;

import java.util.Arrays;
import java.util.Objects;

/**
 * Calibrated camera image of one telescope for one event: a charge (photoelectrons) and a pulse arrival time per
 * pixel. Arrival times have an arbitrary offset that is consistent within the event.
 *
 * @author hal.hildebrand
 */
public final class Image {

    private final double[] charges;
    private final double[] times;

    public Image(double[] charges, double[] times) {
        Objects.requireNonNull(charges, "charges cannot be null");
        Objects.requireNonNull(times, "times cannot be null");
        if (charges.length != times.length) {
            throw new IllegalArgumentException(
            "Charge and time arrays differ in length: " + charges.length + " != " + times.length);
        }
        this.charges = charges.clone();
        this.times = times.clone();
    }

    /**
     * An image with all arrival times equal to zero
     */
    public static Image ofCharges(double... charges) {
        return new Image(charges, new double[charges.length]);
    }

    public double charge(int pixel) {
        return charges[pixel];
    }

    public double[] charges() {
        return charges.clone();
    }

    public int size() {
        return charges.length;
    }

    public double time(int pixel) {
        return times[pixel];
    }

    public double[] times() {
        return times.clone();
    }

    /**
     * Sum of the finite pixel charges
     */
    public double totalCharge() {
        double sum = 0;
        for (var q : charges) {
            if (Double.isFinite(q)) {
                sum += q;
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Image image)) {
            return false;
        }
        return Arrays.equals(charges, image.charges) && Arrays.equals(times, image.times);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(charges) + Arrays.hashCode(times);
    }

    @Override
    public String toString() {
        return String.format("Image[pixels=%d, totalCharge=%.1f]", charges.length, totalCharge());
    }
}
