package flatkv;

import flatkv.command.CommandInterpreter;
import flatkv.command.CommandResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * One client connection. Each inbound read is treated as a single command line; a read
 * cut short by the receive buffer is not reassembled with the next one. {@code quit}
 * closes the connection without a reply. Any I/O or decoding error closes this
 * connection only.
 */
public class SessionHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger logger = LoggerFactory.getLogger(SessionHandler.class);
    private static final String QUIT = "quit";

    private final CommandInterpreter interpreter;

    public SessionHandler(CommandInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.info("Connection from {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.info("Connection with {} closed.", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) throws CharacterCodingException {
        String message = decode(msg).strip();
        logger.debug("Received from {}: {}", ctx.channel().remoteAddress(), message);

        if (QUIT.equalsIgnoreCase(message)) {
            logger.info("Client {} requested to quit.", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }

        CommandResult result = interpreter.execute(message);
        if (!result.ok()) {
            logger.debug("Command '{}' failed: {}", message, result.message().strip());
        }
        logger.debug("Responding to {}: {}", ctx.channel().remoteAddress(), result.message().strip());
        ctx.writeAndFlush(Unpooled.copiedBuffer(result.message(), StandardCharsets.UTF_8))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("Error handling client {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    private static String decode(ByteBuf msg) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(msg.nioBuffer())
                .toString();
    }
}
