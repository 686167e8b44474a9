package com.edge.fieldline.schedule;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import com.edge.fieldline.core.geometry.model.Point3;
import com.edge.fieldline.core.sightline.AlignmentNotFoundException;
import com.edge.fieldline.service.SyntheticViewService;

@ExtendWith(MockitoExtension.class)
class StartupSynthesisRunnerTest
{
    @Mock
    private SyntheticViewService viewService;

    @InjectMocks
    private StartupSynthesisRunner runner;

    @Test
    void testAlignmentFailureIsLoggedNotThrown() throws Exception
    {
        when(viewService.synthesizeAndSave())
                .thenThrow(new AlignmentNotFoundException(new Point3(1, 0, 0), -34, -14, 0));

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
        verify(viewService).synthesizeAndSave();
    }

    @Test
    void testWriteFailureIsLoggedNotThrown() throws Exception
    {
        when(viewService.synthesizeAndSave()).thenThrow(new IOException("disk full"));

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
    }

    @Test
    void testMissingHardwareFileIsLoggedNotThrown() throws Exception
    {
        when(viewService.synthesizeAndSave()).thenThrow(
                new UncheckedIOException(new FileNotFoundException("geometry/hardware.json")));

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
        verify(viewService).synthesizeAndSave();
    }

    @Test
    void testInvalidConfigurationIsLoggedNotThrown() throws Exception
    {
        when(viewService.synthesizeAndSave()).thenThrow(new IllegalArgumentException("smoothing must be >= 0"));

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments()));
    }
}
