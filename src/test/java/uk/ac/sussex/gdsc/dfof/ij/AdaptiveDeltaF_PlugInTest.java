/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2025 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.dfof.ij;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.dfof.ImageSeries;
import uk.ac.sussex.gdsc.dfof.InvalidTauSpecException;
import uk.ac.sussex.gdsc.dfof.TauSpec;

@SuppressWarnings({"javadoc"})
class AdaptiveDeltaF_PlugInTest {
  @Test
  void canSummariseFiniteValues() {
    final ImageSeries series = ImageSeries.wrap(new int[] {2, 2, 1, 1},
        new double[] {1, 2, Double.NaN, Double.POSITIVE_INFINITY});
    Assertions.assertEquals("dF/F min=1.0, max=2.0, mean=1.5, non-finite=2",
        AdaptiveDeltaF_PlugIn.summarise(series));
  }

  @Test
  void canCreateTauSpecFromDialogChoice() {
    Assertions.assertSame(TauSpec.defaults(), AdaptiveDeltaF_PlugIn.createTauSpec(0, "not used"));
    Assertions.assertSame(TauSpec.noFilter(), AdaptiveDeltaF_PlugIn.createTauSpec(1, ""));
    final TauSpec spec = AdaptiveDeltaF_PlugIn.createTauSpec(2, "[22.5, -1 0]");
    Assertions.assertEquals(TauSpec.Mode.CUSTOM, spec.getMode());
    Assertions.assertEquals(22.5, spec.getTau1());
    Assertions.assertEquals(TauSpec.DEFAULT, spec.getTau2());
    Assertions.assertEquals(0, spec.getTau0());
    Assertions.assertSame(TauSpec.noFilter(), AdaptiveDeltaF_PlugIn.createTauSpec(2, "0"));
    Assertions.assertThrows(InvalidTauSpecException.class,
        () -> AdaptiveDeltaF_PlugIn.createTauSpec(2, "22.5 ninety 6"));
  }
}
