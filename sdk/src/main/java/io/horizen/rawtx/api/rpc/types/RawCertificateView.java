package io.horizen.rawtx.api.rpc.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.horizen.rawtx.entity.McCertificate;
import io.horizen.rawtx.utils.BytesUtils;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawCertificateView extends CertificateView {
    public final String hex;
    public final String blockhash;

    public RawCertificateView(McCertificate certificate, String blockHash) {
        super(certificate);
        this.hex = BytesUtils.toHexString(certificate.bytes());
        this.blockhash = blockHash;
    }
}
