package com.rotseproc.algs.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class ConventionalDataLocatorTest {

    @TempDir Path data;

    private void touch(String sub, String name) throws Exception {
        Files.createDirectories(data.resolve(sub));
        Files.writeString(data.resolve(sub).resolve(name), "");
    }

    @Test
    void locateFiltersByWindowFieldAndTelescope() throws Exception {
        touch("image", "100925_sks0246+30_3b_001.fit");
        touch("image", "100927_sks0246+30_3b_001.fit");
        touch("image", "100930_sks0246+30_3b_001.fit");
        touch("image", "100927_sks0246+30_3a_001.fit");
        touch("image", "100927_sks1200-10_3b_001.fit");
        touch("image", "README");
        touch("prod", "100927_sks0246+30_3b_001_cobj.fit");

        ConventionalDataLocator locator = new ConventionalDataLocator();
        DataLocator.Found found = locator.locate(new DataLocator.Query(data, LocalDate.of(2010, 9, 27), "3b", "sks0246+30", 2, 1));

        assertEquals(List.of(data.resolve("image/100925_sks0246+30_3b_001.fit"), data.resolve("image/100927_sks0246+30_3b_001.fit")),
            found.images());
        assertEquals(List.of(data.resolve("prod/100927_sks0246+30_3b_001_cobj.fit")), found.prods());

        DataLocator.Found anyTelescope = locator.locate(new DataLocator.Query(data, LocalDate.of(2010, 9, 27), null, "sks0246+30", 0, 0));
        assertEquals(2, anyTelescope.images().size());
    }

    @Test
    void resolvesFieldFromEncodedNames() throws Exception {
        touch("image", "100927_sks0246+30_3b_001.fit");
        touch("image", "100927_sks1200-10_3b_001.fit");

        ConventionalDataLocator locator = new ConventionalDataLocator();

        assertEquals(Optional.of("sks0246+30"), locator.resolveField(data, 41.9, 30.8));
        assertEquals(Optional.of("sks1200-10"), locator.resolveField(data, 180.5, -10.5));
        assertEquals(Optional.empty(), locator.resolveField(data, 100.0, 0.0));
    }

    @Test
    void explicitTableTakesPrecedence() throws Exception {
        Path table = data.resolve("fields.txt");
        Files.writeString(table, "# field ra dec\nsn2010xx 10.0 20.0\n\nsn2010yy 11.0 20.0\n");

        ConventionalDataLocator locator = new ConventionalDataLocator(ConventionalDataLocator.readFieldCentres(table));

        assertEquals(Optional.of("sn2010yy"), locator.resolveField(data, 10.9, 20.0));
    }

    @Test
    void separationIsGreatCircle() {
        assertEquals(0.0, ConventionalDataLocator.separationDeg(10, 20, 10, 20), 1e-12);
        assertEquals(1.0, ConventionalDataLocator.separationDeg(0, 0, 1, 0), 1e-9);
        assertEquals(90.0, ConventionalDataLocator.separationDeg(0, 0, 0, 90), 1e-9);
        assertEquals(ConventionalDataLocator.decode("sks0246+30").orElseThrow().ra(), 41.5, 1e-9);
        assertTrue(ConventionalDataLocator.decode("sn2010xx").isEmpty());
    }
}
