package de.kherud.heatmap.image;

import java.util.Arrays;

/**
 * Pixel data of one tile with its layout: row-major, interleaved channels,
 * 8-bit unsigned samples.
 */
public final class TileBuffer {

	public static final int BIT_DEPTH = 8;

	private final byte[] data;
	private final int width;
	private final int height;
	private final int channels;

	public TileBuffer(byte[] data, int width, int height, int channels) {
		validate(data, width, height, channels);
		this.data = data;
		this.width = width;
		this.height = height;
		this.channels = channels;
	}

	/**
	 * A single-channel tile where every pixel is {@code value}.
	 *
	 * @param value sample value between 0 and 255
	 */
	public static TileBuffer filled(int width, int height, int value) {
		if (value < 0 || value > 255) {
			throw new IllegalArgumentException("Pixel value must be between 0 and 255: " + value);
		}
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive");
		}
		byte[] data = new byte[Math.multiplyExact(width, height)];
		Arrays.fill(data, (byte) value);
		return new TileBuffer(data, width, height, 1);
	}

	private static void validate(byte[] data, int width, int height, int channels) {
		if (data == null) {
			throw new IllegalArgumentException("Image data cannot be null");
		}
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive");
		}
		if (channels <= 0 || channels > 4) {
			throw new IllegalArgumentException("Channels must be between 1 and 4");
		}
		long expectedSize = (long) width * height * channels;
		if (data.length != expectedSize) {
			throw new IllegalArgumentException(
				String.format("Image data size mismatch: expected %d bytes, got %d", expectedSize, data.length));
		}
	}

	public byte[] getData() {
		return data;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getChannels() {
		return channels;
	}

	/**
	 * @return unsigned sample at a pixel and channel
	 */
	public int sample(int x, int y, int channel) {
		return data[(y * width + x) * channels + channel] & 0xff;
	}

	@Override
	public String toString() {
		return String.format("TileBuffer{size=%dx%d, channels=%d, depth=%d}", width, height, channels, BIT_DEPTH);
	}
}
