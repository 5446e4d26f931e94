package edu.stanford.futuredata.tallyserve.datastore;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.tallyserve.BrokerDataStoreGrpc;
import edu.stanford.futuredata.tallyserve.ReadQueryMessage;
import edu.stanford.futuredata.tallyserve.ReadQueryResponse;
import edu.stanford.futuredata.tallyserve.WriteQueryMessage;
import edu.stanford.futuredata.tallyserve.WriteQueryResponse;
import edu.stanford.futuredata.tallyserve.broker.Broker;
import edu.stanford.futuredata.tallyserve.exceptions.IndexCorruptionException;
import edu.stanford.futuredata.tallyserve.exceptions.TypeMismatchException;
import edu.stanford.futuredata.tallyserve.interfaces.ReadQueryPlan;
import edu.stanford.futuredata.tallyserve.interfaces.Row;
import edu.stanford.futuredata.tallyserve.interfaces.Shard;
import edu.stanford.futuredata.tallyserve.interfaces.SimpleWriteQueryPlan;
import edu.stanford.futuredata.tallyserve.utilities.Utilities;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

class ServiceBrokerDataStore<R extends Row, S extends Shard> extends BrokerDataStoreGrpc.BrokerDataStoreImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ServiceBrokerDataStore.class);
    private final DataStore<R, S> dataStore;

    ServiceBrokerDataStore(DataStore<R, S> dataStore) {
        this.dataStore = dataStore;
    }

    @Override
    public void readQuery(ReadQueryMessage request, StreamObserver<ReadQueryResponse> responseObserver) {
        responseObserver.onNext(readQueryHandler(request));
        responseObserver.onCompleted();
    }

    @SuppressWarnings("unchecked")
    private ReadQueryResponse readQueryHandler(ReadQueryMessage m) {
        long fullStart = System.nanoTime();
        int shardNum = m.getShard();
        ReadQueryResponse r;
        try {
            ReadQueryPlan<S, Object> plan = (ReadQueryPlan<S, Object>) Utilities.byteStringToObject(m.getSerializedQuery());
            Optional<S> shard = dataStore.ensureShard(shardNum);
            if (shard.isEmpty()) {
                return failure(shardNum, Broker.QUERY_FAILURE, "Shard could not be opened");
            }
            long executeStart = System.nanoTime();
            ByteString b = dataStore.shardLock(shardNum).withReaderLock(() -> plan.queryShard(shard.get()));
            dataStore.readQueryExecuteTimes.add((System.nanoTime() - executeStart) / 1000L);
            r = ReadQueryResponse.newBuilder().setReturnCode(Broker.QUERY_SUCCESS).setResponse(b).build();
        } catch (TypeMismatchException e) {
            return failure(shardNum, Broker.QUERY_TYPE_MISMATCH, e.getMessage());
        } catch (IndexCorruptionException e) {
            logger.error("DS{} Shard {} index {} is corrupt: {}", dataStore.dsID, shardNum, e.getKeyName(),
                    e.getMessage());
            return failure(shardNum, Broker.QUERY_SHARD_CORRUPT, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("DS{} Read Query Exception on shard {}: {}", dataStore.dsID, shardNum, e.getMessage());
            return failure(shardNum, Broker.QUERY_FAILURE, String.format("%s: %s", e.getClass().getSimpleName(),
                    e.getMessage()));
        }
        dataStore.readQueryFullTimes.add((System.nanoTime() - fullStart) / 1000L);
        return r;
    }

    private ReadQueryResponse failure(int shardNum, int returnCode, String message) {
        logger.debug("DS{} read on shard {} failed with code {}: {}", dataStore.dsID, shardNum, returnCode, message);
        return ReadQueryResponse.newBuilder().setReturnCode(returnCode)
                .setErrorMessage(message == null ? "" : message).build();
    }

    @Override
    public void writeQuery(WriteQueryMessage request, StreamObserver<WriteQueryResponse> responseObserver) {
        responseObserver.onNext(writeQueryHandler(request));
        responseObserver.onCompleted();
    }

    @SuppressWarnings("unchecked")
    private WriteQueryResponse writeQueryHandler(WriteQueryMessage m) {
        int shardNum = m.getShard();
        try {
            SimpleWriteQueryPlan<R, S> plan =
                    (SimpleWriteQueryPlan<R, S>) Utilities.byteStringToObject(m.getSerializedQuery());
            List<R> rows = (List<R>) Utilities.byteStringToObject(m.getRowData());
            Optional<S> shard = dataStore.ensureShard(shardNum);
            if (shard.isEmpty()) {
                return WriteQueryResponse.newBuilder().setReturnCode(Broker.QUERY_FAILURE)
                        .setErrorMessage("Shard could not be opened").build();
            }
            boolean success = dataStore.shardLock(shardNum).withWriterLock(() -> plan.write(shard.get(), rows));
            if (!success) {
                return WriteQueryResponse.newBuilder().setReturnCode(Broker.QUERY_FAILURE)
                        .setErrorMessage("Write rejected").build();
            }
            logger.debug("DS{} wrote {} rows to shard {}", dataStore.dsID, rows.size(), shardNum);
            return WriteQueryResponse.newBuilder().setReturnCode(Broker.QUERY_SUCCESS).build();
        } catch (RuntimeException e) {
            logger.warn("DS{} Write Query Exception on shard {}: {}", dataStore.dsID, shardNum, e.getMessage());
            return WriteQueryResponse.newBuilder().setReturnCode(Broker.QUERY_FAILURE)
                    .setErrorMessage(String.valueOf(e.getMessage())).build();
        }
    }
}
