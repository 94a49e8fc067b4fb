package dev.mapdl.converter;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DriverFacadeTest {

    @Test
    void bundledListCoversCommonCommands() {
        DriverFacade facade = DriverFacade.bundled("mapdl");

        assertEquals("mapdl", facade.objectName());
        assertTrue(facade.isCallable("K"));
        assertTrue(facade.isCallable("nsel"));
        assertTrue(facade.isCallable("SOLVE"));
        assertFalse(facade.isCallable("*DO"));
        assertFalse(facade.isCallable("NBLOCK"));
        assertFalse(facade.isCallable("INT1"));
    }

    @Test
    void resolvesAliases() {
        DriverFacade facade = DriverFacade.bundled("mapdl");

        assertEquals(Optional.of("prep7"), facade.methodFor("/prep7"));
        assertEquals(Optional.of("k"), facade.methodFor(" K "));
        assertEquals(Optional.empty(), facade.methodFor("/SOLU"));
        assertEquals(Optional.empty(), facade.methodFor(null));
    }

    @Test
    void acceptsCustomCommandSet() {
        DriverFacade facade = new DriverFacade("solver", List.of(" Foo ", "BAR"));

        assertEquals(Set.of("foo", "bar"), facade.callables());
        assertTrue(facade.isCallable("FOO"));
        assertFalse(facade.isCallable("K"));
    }

    @Test
    void skipsCommentsWhenLoading() throws IOException {
        String text = "# header\n\nk\n  NSEL  \n";

        Set<String> names = DriverFacade.loadCommandNames(
            new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

        assertEquals(Set.of("k", "nsel"), names);
    }
}
