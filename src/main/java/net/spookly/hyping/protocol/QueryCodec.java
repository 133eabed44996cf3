package net.spookly.hyping.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import net.spookly.hyping.status.BattleMode;
import net.spookly.hyping.status.StatusRecord;

/**
 * Fixed-layout wire format shared by the responder and the requester.
 *
 * <pre>
 * Request:  [version:1][reserved padding:0..63]
 * Response: [version:1][buildId:8][playersCount:2][playerCap:2][battleModeTag:1][battleModePayload:0..1]
 * </pre>
 *
 * Multi-byte integers are unsigned big-endian. Decoding never throws anything but
 * {@link MalformedMessageException} for bad input.
 */
public final class QueryCodec {
    public static final byte VERSION = 0x01;

    public static final int MIN_REQUEST_SIZE = 1;
    public static final int MAX_REQUEST_SIZE = 64;

    private static final int RESPONSE_HEADER_SIZE = 1 + StatusRecord.BUILD_ID_LENGTH + 2 + 2 + 1;
    public static final int MIN_RESPONSE_SIZE = RESPONSE_HEADER_SIZE;
    public static final int MAX_RESPONSE_SIZE = RESPONSE_HEADER_SIZE + 1;

    /**
     * Request size sent by {@link #encodeRequest()}: padded so no reply outgrows its query.
     */
    public static final int PADDED_REQUEST_SIZE = MAX_RESPONSE_SIZE;

    private static final int PVP_OFF = 0x00;
    private static final int PVP_ON = 0x01;

    private QueryCodec() {
    }

    public static byte[] encodeRequest() {
        byte[] frame = new byte[PADDED_REQUEST_SIZE];
        frame[0] = VERSION;
        return frame;
    }

    public static QueryRequest decodeRequest(byte[] frame) throws MalformedMessageException {
        return decodeRequest(Unpooled.wrappedBuffer(frame));
    }

    /**
     * Decode a request without moving the buffer's reader index.
     */
    public static QueryRequest decodeRequest(ByteBuf buf) throws MalformedMessageException {
        int length = buf.readableBytes();
        if (length < MIN_REQUEST_SIZE) {
            throw new MalformedMessageException("Empty request");
        }
        if (length > MAX_REQUEST_SIZE) {
            throw new MalformedMessageException("Request too large: " + length + " bytes");
        }
        int version = buf.getUnsignedByte(buf.readerIndex());
        requireVersion(version);
        return new QueryRequest(version, length - 1);
    }

    public static byte[] encodeResponse(StatusRecord record) {
        ByteBuf buf = Unpooled.buffer(MAX_RESPONSE_SIZE);
        encodeResponse(record, buf);
        return ByteBufUtil.getBytes(buf);
    }

    public static void encodeResponse(StatusRecord record, ByteBuf out) {
        out.writeByte(VERSION);
        out.writeBytes(record.buildId());
        out.writeShort(record.playersCount());
        out.writeShort(record.playerCap());
        BattleMode mode = record.battleMode();
        out.writeByte(mode.type().tag());
        if (mode.type() == BattleMode.Type.PER_PLAYER) {
            out.writeByte(mode.perPlayerDefault() ? PVP_ON : PVP_OFF);
        }
    }

    public static StatusRecord decodeResponse(byte[] frame) throws MalformedMessageException {
        return decodeResponse(Unpooled.wrappedBuffer(frame));
    }

    /**
     * Decode a complete response frame. Trailing bytes are rejected.
     */
    public static StatusRecord decodeResponse(ByteBuf buf) throws MalformedMessageException {
        int length = buf.readableBytes();
        if (length < MIN_RESPONSE_SIZE) {
            throw new MalformedMessageException("Response truncated: " + length + " bytes");
        }
        ByteBuf in = buf.duplicate();
        requireVersion(in.readUnsignedByte());
        byte[] buildId = new byte[StatusRecord.BUILD_ID_LENGTH];
        in.readBytes(buildId);
        int playersCount = in.readUnsignedShort();
        int playerCap = in.readUnsignedShort();
        int tag = in.readUnsignedByte();
        BattleMode.Type type = BattleMode.Type.fromTag(tag);
        if (type == null) {
            throw new MalformedMessageException("Unknown battle mode tag: " + tag);
        }
        BattleMode mode;
        switch (type) {
            case GLOBAL_PVP:
                mode = BattleMode.globalPvp();
                break;
            case GLOBAL_PVE:
                mode = BattleMode.globalPve();
                break;
            default:
                if (!in.isReadable()) {
                    throw new MalformedMessageException("Per-player battle mode missing its default");
                }
                mode = BattleMode.perPlayer(readFlag(in.readUnsignedByte()));
                break;
        }
        if (in.isReadable()) {
            throw new MalformedMessageException("Unexpected " + in.readableBytes() + " trailing bytes");
        }
        try {
            return new StatusRecord(buildId, playersCount, playerCap, mode);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid status record: " + e.getMessage());
        }
    }

    private static boolean readFlag(int raw) throws MalformedMessageException {
        if (raw == PVP_OFF) {
            return false;
        }
        if (raw == PVP_ON) {
            return true;
        }
        throw new MalformedMessageException("Per-player default must be 0 or 1: " + raw);
    }

    private static void requireVersion(int version) throws MalformedMessageException {
        if (version != VERSION) {
            throw new MalformedMessageException("Unsupported protocol version: " + version);
        }
    }
}
