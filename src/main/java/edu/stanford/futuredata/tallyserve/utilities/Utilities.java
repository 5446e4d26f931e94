package edu.stanford.futuredata.tallyserve.utilities;

import com.google.protobuf.ByteString;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInput;
import java.io.ObjectInputStream;
import java.io.ObjectOutput;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;

public class Utilities {
    private static final Logger logger = LoggerFactory.getLogger(Utilities.class);

    public static Pair<String, Integer> parseConnectString(String connectString) {
        String[] hostPort = connectString.split(":");
        if (hostPort.length != 2) {
            throw new IllegalArgumentException("Expected host:port but got " + connectString);
        }
        String host = hostPort[0];
        Integer port = Integer.parseInt(hostPort[1]);
        return new Pair<>(host, port);
    }

    public static ByteString objectToByteString(Serializable obj) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ObjectOutput out = new ObjectOutputStream(bos)) {
            out.writeObject(obj);
            out.flush();
        } catch (IOException e) {
            logger.error("Serialization Failed {} {}", obj, e.getMessage());
            throw new UncheckedIOException(e);
        }
        return ByteString.copyFrom(bos.toByteArray());
    }

    public static Object byteStringToObject(ByteString b) {
        ByteArrayInputStream bis = new ByteArrayInputStream(b.toByteArray());
        try (ObjectInput in = new ObjectInputStream(bis)) {
            return in.readObject();
        } catch (IOException e) {
            logger.error("Deserialization Failed {}", e.getMessage());
            throw new UncheckedIOException(e);
        } catch (ClassNotFoundException e) {
            logger.error("Deserialization Failed {}", e.getMessage());
            throw new IllegalStateException(e);
        }
    }
}
