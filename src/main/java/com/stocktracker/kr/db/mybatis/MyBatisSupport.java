package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap for the portfolio mappers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);

        config.addMapper(HoldingMapper.class);
        config.addMapper(CandidateMapper.class);
        config.addMapper(DecisionMapper.class);
        config.addMapper(ClosedTradeMapper.class);
        config.addMapper(CycleRunMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
