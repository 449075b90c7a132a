# Multi-stage Dockerfile for the maker service
# Usage: docker build -f deploy/Dockerfile.java -t liquibot/maker .

ARG SERVICE=maker-service

# Stage 1: Build
FROM maven:3.9-amazoncorretto-17 AS builder
ARG SERVICE

WORKDIR /build

# Parent POM and module POMs first so dependencies cache in their own layer
COPY pom.xml .
COPY liquibot-core/pom.xml liquibot-core/
COPY maker-service/pom.xml maker-service/

RUN mvn dependency:go-offline -B -pl ${SERVICE} -am

COPY liquibot-core/src liquibot-core/src
COPY ${SERVICE}/src ${SERVICE}/src

RUN mvn package -DskipTests -pl ${SERVICE} -am

# Stage 2: Runtime
FROM amazoncorretto:17-alpine
ARG SERVICE

WORKDIR /app

COPY --from=builder /build/${SERVICE}/target/*.jar app.jar

# Paper trading unless MAKER_MODE=LIVE and credentials are provided
ENV JAVA_OPTS="-Xmx512m -Xms256m"
ENV MAKER_MODE=PAPER

EXPOSE 8090

ENTRYPOINT ["sh", "-c", "java $JAVA_OPTS -jar app.jar"]
