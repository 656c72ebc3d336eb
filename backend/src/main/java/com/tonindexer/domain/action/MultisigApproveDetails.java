package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

@TypeAlias(MultisigApproveDetails.NAME)
public record MultisigApproveDetails(Long signerIndex, Integer exitCode) implements ActionDetails {

    public static final String NAME = "multisig_approve_data";
}
