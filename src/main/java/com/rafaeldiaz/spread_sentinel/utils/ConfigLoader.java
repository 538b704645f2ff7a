package com.rafaeldiaz.spread_sentinel.utils;

import io.github.cdimascio.dotenv.Dotenv;

public class ConfigLoader implements EnvProvider {
    private final Dotenv dotenv;

    public ConfigLoader() {
        this(Dotenv.configure()
                .directory(System.getProperty("user.dir"))
                .ignoreIfMissing() // En producción se usan variables reales
                .load());
    }

    public ConfigLoader(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    @Override
    public String get(String key) {
        // Primero el entorno del proceso, luego el archivo .env
        String val = System.getenv(key);
        return (val != null) ? val : dotenv.get(key);
    }
}
