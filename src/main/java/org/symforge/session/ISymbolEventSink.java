package org.symforge.session;

/**
 * Receives notifications that the symbols of a module changed, so that a host can drop cached views.
 * Delivery is best effort.
 */
public interface ISymbolEventSink {

    void symbolsChanged(ModuleInfo module);

    /**
     * @return A sink that ignores all notifications.
     */
    static ISymbolEventSink none() {
        return module -> { };
    }
}
