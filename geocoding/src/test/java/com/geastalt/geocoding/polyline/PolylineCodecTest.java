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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolylineCodecTest {

    private static final double TOLERANCE = 1e-6;

    @Test
    @DisplayName("Should decode a known polyline at six digit precision, longitude first")
    void shouldDecodeKnownPolyline() {
        // Reference polyline for (38.5, -120.2), (40.7, -120.95), (43.252, -126.453) at five digits
        List<Coordinate> path = PolylineCodec.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@");

        assertEquals(3, path.size());
        assertEquals(-12.02, path.get(0).longitude(), TOLERANCE);
        assertEquals(3.85, path.get(0).latitude(), TOLERANCE);
        assertEquals(-12.095, path.get(1).longitude(), TOLERANCE);
        assertEquals(4.07, path.get(1).latitude(), TOLERANCE);
        assertEquals(-12.6453, path.get(2).longitude(), TOLERANCE);
        assertEquals(4.3252, path.get(2).latitude(), TOLERANCE);
    }

    @Test
    @DisplayName("Should reproduce coordinates after encoding and decoding")
    void shouldRoundTripCoordinates() {
        List<Coordinate> original = List.of(
                new Coordinate(-3.703790, 40.416775),
                new Coordinate(-3.692127, 40.418889),
                new Coordinate(2.173404, 41.385064),
                new Coordinate(-0.000001, -0.000001),
                new Coordinate(179.999999, -89.999999));

        List<Coordinate> decoded = PolylineCodec.decode(PolylineCodec.encode(original));

        assertEquals(original.size(), decoded.size());
        for (int i = 0; i < original.size(); i++) {
            assertEquals(original.get(i).longitude(), decoded.get(i).longitude(), TOLERANCE, "longitude " + i);
            assertEquals(original.get(i).latitude(), decoded.get(i).latitude(), TOLERANCE, "latitude " + i);
        }
    }

    @Test
    @DisplayName("Should decode empty input to an empty path")
    void shouldDecodeEmptyInput() {
        assertTrue(PolylineCodec.decode("").isEmpty());
        assertTrue(PolylineCodec.decode(null).isEmpty());
    }

    @Test
    @DisplayName("Should reject a polyline cut off mid value")
    void shouldRejectTruncatedPolyline() {
        assertThrows(MalformedResultException.class, () -> PolylineCodec.decode("_p~iF~ps|U_"));
    }

    @Test
    @DisplayName("Should reject characters outside the polyline alphabet")
    void shouldRejectInvalidCharacters() {
        MalformedResultException e = assertThrows(MalformedResultException.class,
                () -> PolylineCodec.decode("_p~iF ~ps|U"));
        assertTrue(e.getMessage().contains("offset 5"));

        assertThrows(MalformedResultException.class, () -> PolylineCodec.decode("_p~iF\u00e9ps|U"));
        assertThrows(MalformedResultException.class, () -> PolylineCodec.decode("{\"shape\":1}"));
    }
}
