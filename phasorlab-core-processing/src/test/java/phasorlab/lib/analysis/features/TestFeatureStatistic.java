/*-
 * #%L
 * This file is part of PhasorLab.
 * %%
 * Copyright (C) 2024 - 2025 PhasorLab developers
 * %%
 * PhasorLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PhasorLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PhasorLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package phasorlab.lib.analysis.features;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestFeatureStatistic {
	
	@Test
	public void test_simpleValues() {
		double[] values = {4, 1, Double.NaN, 3, 2};
		assertEquals(2.5, FeatureStatistic.MEDIAN.compute(values), 1e-12);
		assertEquals(2.5, FeatureStatistic.MEAN.compute(values), 1e-12);
		assertEquals(Math.sqrt(1.25), FeatureStatistic.STD.compute(values), 1e-12);
		assertEquals(1.5, FeatureStatistic.IQR.compute(values), 1e-12);
		assertEquals(1.3, FeatureStatistic.P10.compute(values), 1e-12);
		assertEquals(3.7, FeatureStatistic.P90.compute(values), 1e-12);
	}
	
	@Test
	public void test_matchesCommonsMath() {
		var rng = new java.util.Random(7);
		double[] values = new double[101];
		for (int i = 0; i < values.length; i++)
			values[i] = rng.nextGaussian() * 3 + 10;
		var percentile = new Percentile().withEstimationType(EstimationType.R_7);
		percentile.setData(values);
		assertEquals(percentile.evaluate(50), FeatureStatistic.MEDIAN.compute(values), 1e-10);
		assertEquals(percentile.evaluate(10), FeatureStatistic.P10.compute(values), 1e-10);
		assertEquals(percentile.evaluate(90), FeatureStatistic.P90.compute(values), 1e-10);
		assertEquals(percentile.evaluate(75) - percentile.evaluate(25), FeatureStatistic.IQR.compute(values), 1e-10);
		assertEquals(new StandardDeviation(false).evaluate(values), FeatureStatistic.STD.compute(values), 1e-10);
	}
	
	@Test
	public void test_emptyValues() {
		for (var stat : FeatureStatistic.values()) {
			assertTrue(Double.isNaN(stat.compute(new double[0])));
			assertTrue(Double.isNaN(stat.compute(new double[] {Double.NaN, Double.POSITIVE_INFINITY})));
		}
	}
	
	@Test
	public void test_singleValue() {
		double[] values = {5};
		assertEquals(5, FeatureStatistic.MEDIAN.compute(values));
		assertEquals(0, FeatureStatistic.IQR.compute(values));
		assertEquals(0, FeatureStatistic.STD.compute(values));
	}
	
	@Test
	public void test_keys() {
		for (var stat : FeatureStatistic.values())
			assertEquals(stat, FeatureStatistic.fromKey(stat.getKey()));
		assertEquals("iqr", FeatureStatistic.IQR.getKey());
		assertThrows(IllegalArgumentException.class, () -> FeatureStatistic.fromKey("mode"));
	}

}
