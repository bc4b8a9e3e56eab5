package io.authrelay.host;

public record SubMsg(long id, CosmosMsg msg, ReplyOn replyOn) {
    public static SubMsg of(CosmosMsg msg) {
        return new SubMsg(0L, msg, ReplyOn.NEVER);
    }

    public static SubMsg replyAlways(long id, CosmosMsg msg) {
        return new SubMsg(id, msg, ReplyOn.ALWAYS);
    }

    public static SubMsg replyOnError(long id, CosmosMsg msg) {
        return new SubMsg(id, msg, ReplyOn.ERROR);
    }

    public static SubMsg replyOnSuccess(long id, CosmosMsg msg) {
        return new SubMsg(id, msg, ReplyOn.SUCCESS);
    }
}
