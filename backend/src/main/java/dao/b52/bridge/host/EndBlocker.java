package dao.b52.bridge.host;

/**
 * Logic the host chain runs at the end of every block, after all transactions of the block.
 */
public interface EndBlocker {

    void endBlock(BlockContext ctx);
}
