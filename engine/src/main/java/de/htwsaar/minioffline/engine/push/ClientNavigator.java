package de.htwsaar.minioffline.engine.push;

/**
 * Port zum Öffnen oder Fokussieren einer Ansicht beim Host.
 */
public interface ClientNavigator {

    /**
     * @param url zu öffnende Ansicht
     */
    void openOrFocus(String url);
}
