package com.secidx.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Java-serialization helpers for the mapping blob.
 *
 * Deserialization is restricted to an allow-list of package prefixes so a
 * crafted blob cannot instantiate arbitrary classes.
 */
public final class PersistenceUtils {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceUtils.class);

    private static final List<String> ALLOWED_PREFIXES = List.of(
            "com.secidx.",
            "java.lang.",
            "java.util.",
            "org.roaringbitmap."
    );

    private PersistenceUtils() {}

    public static byte[] toBytes(Serializable object) throws IOException {
        Objects.requireNonNull(object, "Object cannot be null");
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(bos))) {
            oos.writeObject(object);
        }
        return bos.toByteArray();
    }

    public static <T extends Serializable> T fromBytes(byte[] bytes, Class<T> expectedType) throws IOException {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.requireNonNull(expectedType, "Expected type cannot be null");

        try (ValidatingObjectInputStream ois =
                     new ValidatingObjectInputStream(new BufferedInputStream(new ByteArrayInputStream(bytes)))) {
            Object obj = ois.readObject();
            if (!expectedType.isInstance(obj)) {
                logger.error("Deserialized object is not of expected type: {}", expectedType.getName());
                throw new InvalidObjectException("Expected " + expectedType.getName() + ", got "
                        + (obj == null ? "null" : obj.getClass().getName()));
            }
            return expectedType.cast(obj);
        } catch (ClassNotFoundException e) {
            throw new InvalidObjectException("Class not found while reading object: " + e.getMessage());
        }
    }

    /**
     * Writes to a sibling temp file and moves it over the target so readers
     * never observe a half-written file.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(content, "content cannot be null");

        Path absolute = target.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved {} bytes to {}", content.length, absolute);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static boolean isAllowed(String className) {
        String name = className;
        while (name.startsWith("[")) name = name.substring(1);
        if (name.length() == 1) return true; // primitive array component
        if (name.startsWith("L") && name.endsWith(";")) {
            name = name.substring(1, name.length() - 1);
        }
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    private static final class ValidatingObjectInputStream extends ObjectInputStream {

        ValidatingObjectInputStream(InputStream in) throws IOException {
            super(in);
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
            String className = desc.getName();
            if (!isAllowed(className)) {
                logger.error("Attempted to deserialize unauthorized class: {}", className);
                throw new InvalidClassException("Unauthorized class: " + className);
            }
            return super.resolveClass(desc);
        }
    }
}
