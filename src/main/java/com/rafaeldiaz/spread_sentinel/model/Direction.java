package com.rafaeldiaz.spread_sentinel.model;

/**
 * Sentido del arbitraje: A_TO_B = comprar en A y vender en B.
 */
public enum Direction {
    A_TO_B,
    B_TO_A
}
