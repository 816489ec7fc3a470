package com.dtrsign;

import com.dtrsign.error.ErrorKind;
import com.dtrsign.pdf.SignatureInspector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the command line the way the README does: template, demo keystore, sign, verify.
 */
class AppTest {

    private static int run(String... args) {
        return App.commandLine().execute(args);
    }

    @Test
    void createSignVerify(@TempDir Path dir) throws Exception {
        Path dtr = dir.resolve("dtr.pdf");
        Path p12 = dir.resolve("owner.p12");
        Path image = dir.resolve("signature.png");
        Path signed = dir.resolve("dtr-signed.pdf");
        ImageIO.write(TestFixtures.signatureImage(), "png", image.toFile());

        assertEquals(0, run("create-dtr", "--out", dtr.toString(), "--employee", "Juan Dela Cruz", "--month", "March 2025"));
        assertEquals(1, run("verify", "--pdf", dtr.toString()));
        assertEquals(0, run("gen-demo-p12", "--out", p12.toString(), "--password", "123456", "--cn", "Olivia Owner"));
        assertEquals(0, run("sign", "--src", dtr.toString(), "--dest", signed.toString(), "--pkcs12", p12.toString(),
                "--password", "123456", "--image", image.toString(), "--role", "owner"));

        assertTrue(new SignatureInspector().allValid(Files.readAllBytes(signed)));
        assertEquals(0, run("verify", "--pdf", signed.toString()));
        assertEquals(0, run("list-fields", "--src", signed.toString()));
    }

    @Test
    void wrongPasswordExitsWithErrorKind(@TempDir Path dir) throws Exception {
        Path dtr = dir.resolve("dtr.pdf");
        Path p12 = dir.resolve("owner.p12");
        Path image = dir.resolve("signature.png");
        Files.write(dtr, TestFixtures.dtr());
        Files.write(p12, TestFixtures.ownerP12());
        ImageIO.write(TestFixtures.signatureImage(), "png", image.toFile());

        int exit = run("sign", "--src", dtr.toString(), "--dest", dir.resolve("out.pdf").toString(),
                "--pkcs12", p12.toString(), "--password", "not-it", "--image", image.toString());
        assertEquals(App.exitCode(ErrorKind.INVALID_CREDENTIALS), exit);
        assertTrue(Files.notExists(dir.resolve("out.pdf")));
    }

    @Test
    void unreadableImageIsBadInput(@TempDir Path dir) throws Exception {
        Path dtr = dir.resolve("dtr.pdf");
        Path p12 = dir.resolve("owner.p12");
        Path image = dir.resolve("signature.png");
        Files.write(dtr, TestFixtures.dtr());
        Files.write(p12, TestFixtures.ownerP12());
        Files.writeString(image, "not an image");

        assertEquals(App.EXIT_BAD_INPUT, run("sign", "--src", dtr.toString(), "--dest", dir.resolve("out.pdf").toString(),
                "--pkcs12", p12.toString(), "--password", "123456", "--image", image.toString()));
    }
}
