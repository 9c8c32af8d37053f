/*******************************************************************************
 * Copyright (c) 2022 Eclipse RDF4J contributors.
 *
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 *******************************************************************************/
package swiss.sib.swissprot.t2s.source;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.XZInputStream;
import org.tukaani.xz.XZOutputStream;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import net.jpountz.lz4.LZ4FrameInputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;

/**
 * Compression of source files and of written output, recognized by file
 * extension.
 */
public enum Compression {

	LZ4(".lz4", "lz4") {

		@Override
		public InputStream decompress(InputStream in) throws IOException {
			return new LZ4FrameInputStream(new BufferedInputStream(in));
		}

		@Override
		public OutputStream compress(OutputStream out) throws IOException {
			return new LZ4FrameOutputStream(new BufferedOutputStream(out));
		}
	},
	GZIP(".gz", "gzip") {

		@Override
		public InputStream decompress(InputStream in) throws IOException {
			return new GZIPInputStream(in);
		}

		@Override
		public OutputStream compress(OutputStream out) throws IOException {
			return new GZIPOutputStream(out);
		}
	},
	XZ(".xz", "xz") {

		@Override
		public InputStream decompress(InputStream in) throws IOException {
			return new XZInputStream(in);
		}

		@Override
		public OutputStream compress(OutputStream out) throws IOException {
			return new XZOutputStream(out, new LZMA2Options());
		}
	},
	ZSTD(".zstd", "zstd") {

		@Override
		public InputStream decompress(InputStream in) throws IOException {
			return new ZstdInputStream(in);
		}

		@Override
		public OutputStream compress(OutputStream out) throws IOException {
			return new ZstdOutputStream(out);
		}
	},
	NONE("", "none") {

		@Override
		public InputStream decompress(InputStream in) throws IOException {
			return in;
		}

		@Override
		public OutputStream compress(OutputStream out) throws IOException {
			return out;
		}
	};

	private final String extension;
	private final String label;

	private Compression(String extension, String label) {
		this.extension = extension;
		this.label = label;
	}

	public String extension() {
		return extension;
	}

	public abstract InputStream decompress(InputStream in) throws IOException;

	public abstract OutputStream compress(OutputStream out) throws IOException;

	public final InputStream open(Path f) throws IOException {
		return new BufferedInputStream(decompress(new BufferedInputStream(Files.newInputStream(f))));
	}

	public static Compression fromFileName(String name) {
		String lower = name.toLowerCase();
		for (Compression c : values()) {
			if (!c.extension.isEmpty() && lower.endsWith(c.extension)) {
				return c;
			}
		}
		if (lower.endsWith(".zst")) {
			return ZSTD;
		}
		return NONE;
	}

	/**
	 * @param label as used in a mapping target, e.g. "gzip". Null means none.
	 */
	public static Compression fromLabel(String label) {
		if (label == null || label.isBlank()) {
			return NONE;
		}
		String lower = label.trim().toLowerCase();
		for (Compression c : values()) {
			if (c.label.equals(lower) || c.extension.equals("." + lower)) {
				return c;
			}
		}
		throw new IllegalArgumentException("Unknown compression: " + label);
	}

	public static String removeExtension(String name) {
		for (Compression c : values()) {
			if (!c.extension.isEmpty() && name.endsWith(c.extension())) {
				return name.substring(0, name.length() - c.extension.length());
			}
		}
		return name;
	}
}
