package com.example.mobileview.detect;

import com.example.mobileview.UserAgents;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MobileUserAgentsTest {

    private final MobileUserAgents agents = MobileUserAgents.defaults();

    @Test
    void phonesAndTabletsMatch() {
        assertTrue(agents.isMobile(UserAgents.IPHONE));
        assertTrue(agents.isMobile(UserAgents.ANDROID));
        assertTrue(agents.isMobile(UserAgents.OPERA_MINI));
        assertTrue(agents.isMobile("BlackBerry9700/5.0.0.351 Profile/MIDP-2.1 Configuration/CLDC-1.1"));
    }

    @Test
    void matchIsCaseInsensitive() {
        assertTrue(agents.isMobile("SOME-IPHONE-CLIENT"));
    }

    @Test
    void desktopBrowsersDoNotMatch() {
        assertFalse(agents.isMobile(UserAgents.DESKTOP_CHROME));
        assertFalse(agents.isMobile(UserAgents.DESKTOP_FIREFOX));
        assertFalse(agents.isMobile("curl/8.4.0"));
    }

    @Test
    void missingHeaderIsNotMobile() {
        assertFalse(agents.isMobile(null));
        assertFalse(agents.isMobile(""));
        assertFalse(agents.isMobile("   "));
    }

    @Test
    void customPatternReplacesDefaults() {
        MobileUserAgents custom = new MobileUserAgents("kiosk-app");
        assertTrue(custom.isMobile("Kiosk-App/2.1"));
        assertFalse(custom.isMobile(UserAgents.IPHONE));
    }

    @Test
    void customPatternIgnoresCase() {
        MobileUserAgents custom = new MobileUserAgents("iPad|KioskApp");
        assertTrue(custom.isMobile("Mozilla/5.0 (iPad; CPU OS 17_0 like Mac OS X)"));
        assertTrue(custom.isMobile("kioskapp/3.0"));
        assertFalse(custom.isMobile(UserAgents.DESKTOP_CHROME));
    }

    @Test
    void blankPatternFallsBackToDefaults() {
        assertEquals(MobileUserAgents.DEFAULT_PATTERN, new MobileUserAgents(" ").pattern());
    }
}
