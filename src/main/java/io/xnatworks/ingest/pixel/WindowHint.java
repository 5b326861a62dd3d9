/*
 * XNAT DICOM Ingest
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.ingest.pixel;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Iterator;

/**
 * Window center/width pair used to narrow the displayed sample range.
 *
 * Multi-valued hints (per-frame window lists) are reduced to their first value.
 */
public final class WindowHint {

    private final double center;
    private final double width;

    private WindowHint(double center, double width) {
        this.center = center;
        this.width = width;
    }

    /**
     * @return the hint, or null when the pair is not usable (non-finite, or width not positive)
     */
    public static WindowHint of(double center, double width) {
        if (!Double.isFinite(center) || !Double.isFinite(width) || width <= 0) {
            return null;
        }
        return new WindowHint(center, width);
    }

    /**
     * Build a hint from the first values of attribute value lists.
     */
    public static WindowHint of(double[] centers, double[] widths) {
        if (centers == null || widths == null || centers.length == 0 || widths.length == 0) {
            return null;
        }
        return of(centers[0], widths[0]);
    }

    /**
     * Build a hint from loosely typed values: numbers, numeric strings, backslash separated
     * strings, collections or arrays (first element). Anything else yields null.
     */
    public static WindowHint parse(Object center, Object width) {
        Double c = firstNumber(center);
        Double w = firstNumber(width);
        if (c == null || w == null) {
            return null;
        }
        return of(c, w);
    }

    private static Double firstNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            String text = value.toString();
            int sep = text.indexOf('\\');
            if (sep >= 0) {
                text = text.substring(0, sep);
            }
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof Collection) {
            Iterator<?> it = ((Collection<?>) value).iterator();
            return it.hasNext() ? firstNumber(it.next()) : null;
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0 ? firstNumber(Array.get(value, 0)) : null;
        }
        return null;
    }

    public double getCenter() {
        return center;
    }

    public double getWidth() {
        return width;
    }

    public double getLower() {
        return center - width / 2;
    }

    public double getUpper() {
        return center + width / 2;
    }

    @Override
    public String toString() {
        return "WindowHint{center=" + center + ", width=" + width + "}";
    }
}
