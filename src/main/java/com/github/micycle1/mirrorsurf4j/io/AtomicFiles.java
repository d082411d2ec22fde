package com.github.micycle1.mirrorsurf4j.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * All-or-nothing text output: content goes to a sibling temp file which
 * replaces the target only once fully written.
 * <p>
 * Temp files are created like a plain write (mode from the umask); when the
 * target already exists its POSIX permissions are carried over.
 */
final class AtomicFiles {

	private AtomicFiles() {
	}

	static void writeString(Path target, CharSequence content) throws IOException {
		writeAll(Map.of(target, content));
	}

	/**
	 * Stages every file next to its target, then renames them into place in
	 * iteration order. A failure while staging leaves every target untouched;
	 * only a failed rename can leave the set partly replaced.
	 */
	static void writeAll(Map<Path, ? extends CharSequence> contents) throws IOException {
		Map<Path, Path> staged = new LinkedHashMap<>();
		try {
			for (Map.Entry<Path, ? extends CharSequence> e : contents.entrySet()) {
				Path target = e.getKey().toAbsolutePath();
				staged.put(target, stage(target, e.getValue()));
			}
			for (Map.Entry<Path, Path> e : staged.entrySet()) {
				move(e.getValue(), e.getKey());
			}
		} catch (IOException | RuntimeException e) {
			for (Path tmp : staged.values()) {
				deleteQuietly(tmp, e);
			}
			throw e;
		}
	}

	private static Path stage(Path target, CharSequence content) throws IOException {
		Path tmp = createSibling(target);
		try {
			try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
				writer.append(content);
			}
			if (Files.isRegularFile(target) && Files.getFileStore(tmp).supportsFileAttributeView(PosixFileAttributeView.class)) {
				Files.setPosixFilePermissions(tmp, Files.getPosixFilePermissions(target));
			}
		} catch (IOException | RuntimeException e) {
			deleteQuietly(tmp, e);
			throw e;
		}
		return tmp;
	}

	private static Path createSibling(Path target) throws IOException {
		FileAlreadyExistsException taken = null;
		for (int attempt = 0; attempt < 16; attempt++) {
			String suffix = Long.toUnsignedString(ThreadLocalRandom.current().nextLong(), 36);
			Path tmp = target.resolveSibling("." + target.getFileName() + "." + suffix + ".tmp");
			try {
				return Files.createFile(tmp);
			} catch (FileAlreadyExistsException e) {
				taken = e;
			}
		}
		throw taken;
	}

	private static void move(Path tmp, Path target) throws IOException {
		try {
			Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteQuietly(Path tmp, Exception failure) {
		try {
			Files.deleteIfExists(tmp);
		} catch (IOException cleanup) {
			failure.addSuppressed(cleanup);
		}
	}
}
