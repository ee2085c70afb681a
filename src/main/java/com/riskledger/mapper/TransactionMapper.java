package com.riskledger.mapper;

import com.riskledger.domain.model.LedgerTransaction;
import com.riskledger.entity.TransactionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TransactionMapper {

    TransactionEntity toEntity(LedgerTransaction transaction);

    LedgerTransaction toDomain(TransactionEntity entity);

    List<LedgerTransaction> toDomainList(List<TransactionEntity> entities);
}
