package com.rafaeldiaz.spread_sentinel.connect;

/**
 * Error a nivel de exchange: HTTP no exitoso, código de error de la API o respuesta ilegible.
 */
public class VenueException extends Exception {

    private final String venue;

    public VenueException(String venue, String message) {
        super("[" + venue + "] " + message);
        this.venue = venue;
    }

    public VenueException(String venue, String message, Throwable cause) {
        super("[" + venue + "] " + message, cause);
        this.venue = venue;
    }

    public String venue() {
        return venue;
    }
}
