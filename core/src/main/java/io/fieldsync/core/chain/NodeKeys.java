package io.fieldsync.core.chain;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Objects;

/**
 * Ed25519 signing identity of a node (or of the gateway, for downlink records).
 * <p>
 * On disk:
 *  - node.key  PKCS#8 private key
 *  - node.pub  X.509 public key
 * <p>
 * Key files are written to a temp file and moved into place so a crash never
 * leaves a half-written key behind.
 */
public final class NodeKeys {
    public static final String ALGORITHM = "Ed25519";

    private static final String PRIVATE_FILE = "node.key";
    private static final String PUBLIC_FILE = "node.pub";

    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    public NodeKeys(KeyPair pair) {
        Objects.requireNonNull(pair, "pair");
        this.privateKey = pair.getPrivate();
        this.publicKey = pair.getPublic();
    }

    public static NodeKeys generate() {
        try {
            return new NodeKeys(KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    /**
     * Load the key pair from {@code dir}, generating and persisting a new one when
     * none exists yet.
     */
    public static NodeKeys loadOrCreate(Path dir) {
        Path priv = dir.resolve(PRIVATE_FILE);
        Path pub = dir.resolve(PUBLIC_FILE);
        try {
            Files.createDirectories(dir);
            if (Files.exists(priv) && Files.exists(pub)) {
                KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
                PrivateKey pk = kf.generatePrivate(new PKCS8EncodedKeySpec(Files.readAllBytes(priv)));
                PublicKey pu = kf.generatePublic(new X509EncodedKeySpec(Files.readAllBytes(pub)));
                return new NodeKeys(new KeyPair(pu, pk));
            }
            NodeKeys fresh = generate();
            writeAtomically(priv, fresh.privateKey.getEncoded());
            writeAtomically(pub, fresh.publicKey.getEncoded());
            return fresh;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load node keys from " + dir, e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Corrupt node keys in " + dir, e);
        }
    }

    /** Decode an X.509-encoded Ed25519 public key. */
    public static PublicKey decodePublicKey(byte[] x509) {
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(x509));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("not an Ed25519 public key", e);
        }
    }

    public static PublicKey readPublicKey(Path file) {
        try {
            return decodePublicKey(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read public key " + file, e);
        }
    }

    /** Sign {@code data}; Ed25519 signatures are always 64 bytes. */
    public byte[] sign(byte[] data) {
        try {
            Signature s = Signature.getInstance(ALGORITHM);
            s.initSign(privateKey);
            s.update(data);
            return s.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("signing failed", e);
        }
    }

    public static boolean verify(PublicKey key, byte[] data, byte[] signature) {
        try {
            Signature s = Signature.getInstance(ALGORITHM);
            s.initVerify(key);
            s.update(data);
            return s.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
    }
}
