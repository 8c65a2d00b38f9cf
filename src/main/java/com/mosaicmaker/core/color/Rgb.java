package com.mosaicmaker.core.color;

/**
 * An opaque color with three 8-bit channels.
 */
public record Rgb(int red, int green, int blue) {

    public Rgb {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * Reads the color channels of a packed ARGB pixel, ignoring alpha.
     */
    public static Rgb fromArgb(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    public int toArgb() {
        return 0xFF000000 | (red << 16) | (green << 8) | blue;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range 0-255: " + value);
        }
    }

    @Override
    public String toString() {
        return "(" + red + "," + green + "," + blue + ")";
    }
}
