package colorbatch.engine;

import colorbatch.testing.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;

import javax.imageio.*;
import javax.imageio.stream.*;
import java.awt.image.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.stream.*;

import static org.junit.jupiter.api.Assertions.*;

class ImageIoCodecTest {

    @TempDir
    Path dir;

    private final ImageIoCodec codec = new ImageIoCodec();

    @Test
    void decodesAnImageFile() throws IOException {
        Path png = ImageFixtures.writeImage(dir.resolve("gray.png"), 40, 30, "png");

        try (Picture picture = codec.decode(png)) {
            assertEquals(40, picture.width());
            assertEquals(30, picture.height());
        }
    }

    @Test
    void contentThatIsNotAnImageIsRejected() throws IOException {
        Path fake = Files.writeString(dir.resolve("notes.png"), "this is plain text, not a PNG");

        InvalidImageException e = assertThrows(InvalidImageException.class, () -> codec.decode(fake));
        assertTrue(e.getMessage().startsWith("File is not a valid image: " + fake));
        assertTrue(e.getMessage().contains("(detected "));
    }

    @Test
    void encodesInTheRequestedContainer() throws IOException {
        Path target = dir.resolve("out.jpg");
        try (Picture picture = new Picture(ImageFixtures.gray(20, 10))) {
            codec.encode(picture, target, ImageFormat.JPEG);
        }

        BufferedImage written = ImageIO.read(target.toFile());
        assertNotNull(written);
        assertEquals(20, written.getWidth());
        assertEquals(10, written.getHeight());
    }

    @Test
    void alphaIsFlattenedForOpaqueContainers() throws IOException {
        Path target = dir.resolve("out.bmp");
        BufferedImage argb = new BufferedImage(8, 8, BufferedImage.TYPE_INT_ARGB);

        try (Picture picture = new Picture(argb)) {
            codec.encode(picture, target, ImageFormat.BMP);
        }

        assertNotNull(ImageIO.read(target.toFile()));
    }

    @Test
    void formatsWithoutAnEncoderFailWithIoException() {
        try (Picture picture = new Picture(ImageFixtures.gray(4, 4))) {
            IOException e = assertThrows(IOException.class,
                    () -> codec.encode(picture, dir.resolve("out.wmf"), ImageFormat.WMF));
            assertTrue(e.getMessage().contains("No encoder available for WMF"));
        }
    }

    @Test
    void failedWriteLeavesTheExistingTargetUntouched() throws IOException {
        Path target = Files.writeString(dir.resolve("keep.png"), "previous result");
        ImageIoCodec failing = new ImageIoCodec() {
            @Override
            protected void writeImage(ImageWriter writer, BufferedImage image, ImageOutputStream out) throws IOException {
                out.write(new byte[]{(byte) 0x89, 'P', 'N', 'G'});
                throw new IOException("disk full");
            }
        };

        try (Picture picture = new Picture(ImageFixtures.gray(4, 4))) {
            IOException e = assertThrows(IOException.class, () -> failing.encode(picture, target, ImageFormat.PNG));
            assertEquals("disk full", e.getMessage());
        }

        assertEquals("previous result", Files.readString(target));
        assertFalse(Files.exists(ImageIoCodec.partialFileFor(target)));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(target), files.collect(Collectors.toList()));
        }
    }

    @Test
    void successfulWriteReplacesTheTargetAndLeavesNoPartialFile() throws IOException {
        Path target = Files.writeString(dir.resolve("replace.png"), "previous result");

        try (Picture picture = new Picture(ImageFixtures.gray(6, 5))) {
            codec.encode(picture, target, ImageFormat.PNG);
        }

        assertEquals(6, ImageIO.read(target.toFile()).getWidth());
        assertFalse(Files.exists(ImageIoCodec.partialFileFor(target)));
    }
}
