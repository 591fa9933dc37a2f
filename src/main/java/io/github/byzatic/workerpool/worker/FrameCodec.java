package io.github.byzatic.workerpool.worker;

import org.jetbrains.annotations.NotNull;

import java.io.*;

/**
 * Java serialization plus length-prefixed framing used on the worker process pipes.
 * A frame is a 4-byte big-endian length followed by that many payload bytes.
 */
public final class FrameCodec {
    static final int MAX_FRAME_BYTES = Integer.MAX_VALUE - 8;

    private FrameCodec() {
    }

    public static byte @NotNull [] serialize(@NotNull Object value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        return bytes.toByteArray();
    }

    public static @NotNull Object deserialize(byte @NotNull [] payload) throws IOException, ClassNotFoundException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            return in.readObject();
        }
    }

    public static void writeFrame(@NotNull DataOutputStream out, byte @NotNull [] payload) throws IOException {
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();
    }

    /**
     * Reads one frame.
     *
     * @throws EOFException when the peer closed the stream
     */
    public static byte @NotNull [] readFrame(@NotNull DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > MAX_FRAME_BYTES) {
            throw new StreamCorruptedException("Invalid frame length " + length);
        }
        byte[] payload = new byte[length];
        in.readFully(payload);
        return payload;
    }
}
