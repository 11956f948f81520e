package io.github.fiserro.synphot.compose;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import io.github.fiserro.synphot.BrokenChainException;
import io.github.fiserro.synphot.ObservationMode;
import io.github.fiserro.synphot.component.Component;
import io.github.fiserro.synphot.spectrum.TabularSpectralElement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for {@link OpticalComposer} and {@link SensitivityComposer} on a mocked mode.
 */
@ExtendWith(MockitoExtension.class)
class OpticalComposerTest {

  private static final Component WINDOW = new Component("win.dat", new TabularSpectralElement(
      "win.dat", new double[] {4000, 6000}, new double[] {0.9, 0.9}));
  private static final Component FILTER = new Component("f.dat", new TabularSpectralElement(
      "f.dat", new double[] {4500, 5000, 5500}, new double[] {0.2, 0.8, 0.2}));

  @Mock
  private ObservationMode mode;

  private final OpticalComposer composer = new OpticalComposer();

  @Test
  void compose_shouldMultiplyComponentsOnMergedGrid() {
    when(mode.components()).thenReturn(List.of(WINDOW, FILTER));
    when(mode.modeString()).thenReturn("x,y");

    TabularSpectralElement throughput = composer.compose(mode);

    assertEquals("win.dat*f.dat", throughput.name());
    assertArrayEquals(new double[] {4000, 4500, 5000, 5500, 6000}, throughput.waveSet());
    assertArrayEquals(new double[] {0, 0.18, 0.72, 0.18, 0}, throughput.values(), 1e-12);
  }

  @Test
  void compose_threeComponents_shouldEvaluateEveryComponentAtEachGridPoint() {
    Component rampA = new Component("a", new TabularSpectralElement(
        "a", new double[] {1000, 3000}, new double[] {0, 1}));
    Component rampB = new Component("b", new TabularSpectralElement(
        "b", new double[] {1000, 3000}, new double[] {0, 1}));
    Component flat = new Component("c", new TabularSpectralElement(
        "c", new double[] {1000, 2000, 3000}, new double[] {1, 1, 1}));
    when(mode.components()).thenReturn(List.of(rampA, rampB, flat));
    when(mode.modeString()).thenReturn("x,y,z");

    TabularSpectralElement throughput = composer.compose(mode);

    assertArrayEquals(new double[] {1000, 2000, 3000}, throughput.waveSet());
    assertArrayEquals(new double[] {0, 0.25, 1}, throughput.values(), 1e-12);
  }

  @Test
  void compose_resultArrays_shouldNotExposeComponentData() {
    when(mode.components()).thenReturn(List.of(FILTER));
    when(mode.modeString()).thenReturn("x");

    composer.compose(mode).waveSet()[0] = -1;
    composer.compose(mode).values()[1] = -1;
    FILTER.throughput().orElseThrow().waveSet()[0] = -1;

    assertEquals(0.8, composer.compose(mode).evaluate(5000), 1e-12);
    assertEquals(4500, composer.compose(mode).waveSet()[0]);
  }

  @Test
  void compose_shouldBeReproducible() {
    when(mode.components()).thenReturn(List.of(WINDOW, FILTER));
    when(mode.modeString()).thenReturn("x,y");

    assertArrayEquals(composer.compose(mode).values(), composer.compose(mode).values());
  }

  @Test
  void compose_noComponents_shouldFail() {
    when(mode.components()).thenReturn(List.of());
    when(mode.modeString()).thenReturn("x");

    assertThrows(BrokenChainException.class, () -> composer.compose(mode));
  }

  @Test
  void compose_onlyClearComponents_shouldFail() {
    when(mode.components()).thenReturn(List.of(new Component("clear", null)));
    when(mode.modeString()).thenReturn("x");

    assertThrows(BrokenChainException.class, () -> composer.compose(mode));
  }

  @Test
  void sensitivity_shouldScaleThroughputByWavelengthAndConstant() {
    when(mode.components()).thenReturn(List.of(WINDOW));
    when(mode.modeString()).thenReturn("x");
    when(mode.sensitivityConstant()).thenReturn(2.0);

    TabularSpectralElement sensitivity = new SensitivityComposer(composer).compose(mode);

    assertArrayEquals(new double[] {4000, 6000}, sensitivity.waveSet());
    assertArrayEquals(new double[] {0.9 * 4000 * 2, 0.9 * 6000 * 2}, sensitivity.values(), 1e-9);
  }

  @Test
  void apply_shouldDelegateToCompose() {
    when(mode.components()).thenReturn(List.of(FILTER));
    when(mode.modeString()).thenReturn("x");

    assertEquals("f.dat", composer.apply(mode).name());
  }
}
