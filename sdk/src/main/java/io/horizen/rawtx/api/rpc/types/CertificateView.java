package io.horizen.rawtx.api.rpc.types;

import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.entity.McOutput;
import io.horizen.rawtx.utils.BytesUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class CertificateView {
    public final String certid;
    public final int version;
    public final CertDataView cert;
    public final List<InputView> vin;
    public final List<OutputView> vout;

    public CertificateView(McCertificate certificate) {
        this.certid = certificate.idHex();
        this.version = certificate.version();
        this.cert = new CertDataView(certificate);
        this.vin = certificate.inputs().stream().map(InputView::new).collect(Collectors.toList());
        List<McOutput> outputs = certificate.outputs();
        this.vout = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            McOutput output = outputs.get(i);
            var backwardTransfer = certificate.backwardTransferInfo(i);
            this.vout.add(backwardTransfer.isPresent()
                    ? new OutputView(output, i, backwardTransfer.get())
                    : new OutputView(output, i));
        }
    }

    public static class CertDataView {
        public final String scid;
        public final int epochNumber;
        public final long quality;
        public final String endEpochBlockHash;
        public final String scProof;
        public final BigDecimal totalAmount;

        public CertDataView(McCertificate certificate) {
            this.scid = BytesUtils.toHexString(certificate.scId());
            this.epochNumber = certificate.epochNumber();
            this.quality = certificate.quality();
            this.endEpochBlockHash = BytesUtils.toHexString(certificate.endEpochBlockHash());
            this.scProof = BytesUtils.toHexString(certificate.scProof());
            this.totalAmount = ValueConverter.toCoins(certificate.backwardTransfersTotalAmount());
        }
    }
}
