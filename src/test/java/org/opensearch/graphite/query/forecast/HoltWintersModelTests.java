/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.query.forecast;

import org.opensearch.test.OpenSearchTestCase;

public class HoltWintersModelTests extends OpenSearchTestCase {

    public void testFlatSeriesPredictsItself() {
        // Arrange
        double[] series = { 4, 4, 4, 4, 4, 4 };

        // Act
        HoltWintersModel.Analysis analysis = HoltWintersModel.analyze(series, 1, 2);

        // Assert
        for (int i = 0; i < series.length; i++) {
            assertEquals(4, analysis.predictions()[i], 1e-9);
            assertEquals(0, analysis.deviations()[i], 1e-9);
        }
    }

    public void testFirstStepsFollowSmoothingConstants() {
        // Arrange
        double[] series = { 1, 3 };

        // Act
        HoltWintersModel.Bands bands = HoltWintersModel.confidenceBands(series, 1, 100, 3);

        // Assert
        assertEquals(1, bands.lower()[0], 1e-9);
        assertEquals(1, bands.upper()[0], 1e-9);
        assertEquals(0.4, bands.lower()[1], 1e-9);
        assertEquals(1.6, bands.upper()[1], 1e-9);
    }

    public void testMissingSampleBreaksNextPrediction() {
        // Arrange
        double[] series = { 5, Double.NaN, 5, 5 };

        // Act
        HoltWintersModel.Analysis analysis = HoltWintersModel.analyze(series, 1, 100);

        // Assert
        assertEquals(5, analysis.predictions()[0], 1e-9);
        assertEquals(5, analysis.predictions()[1], 1e-9);
        assertTrue(Double.isNaN(analysis.predictions()[2]));
        assertFalse(Double.isNaN(analysis.predictions()[3]));
    }

    public void testBandsAreMissingWithoutPrediction() {
        // Act
        HoltWintersModel.Bands bands = HoltWintersModel.confidenceBands(new double[] { 5, Double.NaN, 5 }, 1, 100, 3);

        // Assert
        assertTrue(Double.isNaN(bands.lower()[2]));
        assertTrue(Double.isNaN(bands.upper()[2]));
    }
}
