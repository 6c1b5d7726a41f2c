package sh.erebus.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * First packet on a socket: carries the signed grant.
 */
@Value
public class ConnectPacket implements Packet {
    public static final String TYPE = "connect";

    @JsonProperty("grantJWT")
    String grantJWT;

    @JsonCreator
    public ConnectPacket(@JsonProperty("grantJWT") String grantJWT) {
        this.grantJWT = grantJWT;
    }

    @Override
    public String getPacketType() {
        return TYPE;
    }

    @Override
    public boolean isWellFormed() {
        return Packet.nonEmpty(grantJWT);
    }
}
