/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.polyline;

import com.geastalt.geocoding.exception.MalformedResultException;
import com.geastalt.geocoding.model.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoded polyline format with six decimal digits, as returned in Valhalla trip shapes.
 * Each point is a zigzag, 5-bit chunked delta against the previous point, latitude first.
 */
public final class PolylineCodec {

    private static final double FACTOR = 1e6;

    private PolylineCodec() {
    }

    public static List<Coordinate> decode(String encoded) {
        List<Coordinate> path = new ArrayList<>();
        if (encoded == null || encoded.isEmpty()) {
            return path;
        }

        int[] index = {0};
        long lat = 0;
        long lng = 0;
        while (index[0] < encoded.length()) {
            lat += nextDelta(encoded, index);
            lng += nextDelta(encoded, index);
            path.add(new Coordinate(lng / FACTOR, lat / FACTOR));
        }
        return path;
    }

    public static String encode(List<Coordinate> path) {
        StringBuilder out = new StringBuilder();
        long prevLat = 0;
        long prevLng = 0;
        for (Coordinate point : path) {
            long lat = Math.round(point.latitude() * FACTOR);
            long lng = Math.round(point.longitude() * FACTOR);
            appendValue(out, lat - prevLat);
            appendValue(out, lng - prevLng);
            prevLat = lat;
            prevLng = lng;
        }
        return out.toString();
    }

    private static long nextDelta(String encoded, int[] index) {
        long result = 0;
        int shift = 0;
        int b;
        do {
            if (index[0] >= encoded.length()) {
                throw new MalformedResultException("Truncated polyline at offset " + index[0]);
            }
            int offset = index[0]++;
            b = encoded.charAt(offset) - 63;
            if (b < 0 || b > 0x3f) {
                throw new MalformedResultException("Invalid polyline character '" + encoded.charAt(offset)
                        + "' at offset " + offset);
            }
            result |= (long) (b & 0x1f) << shift;
            shift += 5;
        } while (b >= 0x20);
        return (result & 1) != 0 ? ~(result >> 1) : (result >> 1);
    }

    private static void appendValue(StringBuilder out, long value) {
        long v = value < 0 ? ~(value << 1) : (value << 1);
        while (v >= 0x20) {
            out.append((char) ((0x20 | (v & 0x1f)) + 63));
            v >>= 5;
        }
        out.append((char) (v + 63));
    }
}
