package org.symforge.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.symforge.api.ISymbolSet;
import org.symforge.api.SymbolBuilderException;
import org.symforge.api.SymbolErrorCode;
import org.symforge.arch.MachineArchitecture;
import org.symforge.config.SymbolSetOptions;
import org.symforge.importer.ISymbolImporter;
import org.symforge.junit.extensions.logging.LogWatchExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SymbolBuilderSessionTest {

    private static final ModuleInfo APP = new ModuleInfo("app.exe", "app", 0x140000000L, 0x20000);
    private static final ModuleInfo KERNEL = new ModuleInfo("kernel32.dll", "kernel32", 0x7ff800000000L, 0x100000);

    private SymbolBuilderSession session;

    @BeforeEach
    void setUp() {
        session = new SymbolBuilderSession(MachineArchitecture.amd64(), SymbolSetOptions.defaults(), null, null);
    }

    @Test
    @DisplayName("Processes are opened once and found by id")
    void openProcess_rejectsDuplicates() throws SymbolBuilderException {
        SymbolBuilderProcess process = session.openProcess(42);

        assertSame(process, session.findProcess(42).orElseThrow());
        assertTrue(session.findProcess(7).isEmpty());
        SymbolBuilderException e = assertThrows(SymbolBuilderException.class, () -> session.openProcess(42));
        assertEquals(SymbolErrorCode.INVALID_ARGUMENT, e.getCode());
    }

    @Test
    @DisplayName("Symbol sets are keyed by module and found by address")
    void createSymbolSet_perModule() throws SymbolBuilderException {
        SymbolBuilderProcess process = session.openProcess(1);
        ISymbolSet app = process.createSymbolSet(APP);
        ISymbolSet kernel = process.createSymbolSet(KERNEL);

        assertSame(app, process.requireSymbolSet("app.exe"));
        assertSame(kernel, process.findSymbolSetForAddress(0x7ff800001000L).orElseThrow());
        assertSame(app, process.findSymbolSetForAddress(0x14001ffffL).orElseThrow());
        assertTrue(process.findSymbolSetForAddress(0x140020000L).isEmpty());
        assertEquals(2, process.symbolSets().size());

        SymbolBuilderException duplicate = assertThrows(SymbolBuilderException.class, () -> process.createSymbolSet(APP));
        assertEquals(SymbolErrorCode.INVALID_ARGUMENT, duplicate.getCode());
        SymbolBuilderException missing = assertThrows(SymbolBuilderException.class, () -> process.requireSymbolSet("ntdll.dll"));
        assertEquals(SymbolErrorCode.NOT_FOUND, missing.getCode());
    }

    @Test
    @DisplayName("Symbol sets of one process are independent")
    void symbolSets_areIndependent() throws SymbolBuilderException {
        SymbolBuilderProcess process = session.openProcess(1);
        ISymbolSet app = process.createSymbolSet(APP);
        ISymbolSet kernel = process.createSymbolSet(KERNEL);

        long udt = app.addUdt("Widget", null);

        assertEquals(udt, app.findByName("Widget"));
        assertThrows(SymbolBuilderException.class, () -> kernel.findByName("Widget"));
    }

    @Test
    @DisplayName("Removing a module disconnects its importer")
    void removeSymbolSet_disconnectsImporter() throws SymbolBuilderException {
        SymbolBuilderProcess process = session.openProcess(1);
        ISymbolSet app = process.createSymbolSet(APP);
        ISymbolImporter importer = mock(ISymbolImporter.class);
        app.connectImporter(importer);

        assertTrue(process.removeSymbolSet("app.exe"));
        assertFalse(process.removeSymbolSet("app.exe"));

        verify(importer).disconnect();
        assertTrue(process.findSymbolSet("app.exe").isEmpty());
    }

    @Test
    @DisplayName("Closing a process drops all of its symbol sets")
    void closeProcess_dropsSymbolSets() throws SymbolBuilderException {
        SymbolBuilderProcess process = session.openProcess(1);
        process.createSymbolSet(APP);
        process.createSymbolSet(KERNEL);

        assertTrue(session.closeProcess(1));

        assertTrue(process.symbolSets().isEmpty());
        assertTrue(session.findProcess(1).isEmpty());
        assertFalse(session.closeProcess(1));
        assertNotNull(session.openProcess(1));
    }

    @Test
    @DisplayName("A session built from configuration carries the reference options")
    void create_fromConfiguration() {
        SymbolBuilderSession configured = SymbolBuilderSession.create(MachineArchitecture.amd64(), null, null);

        assertEquals(SymbolSetOptions.defaults(), configured.options());
        assertEquals(64, configured.architecture().bitness());
    }
}
